package com.lumen.service.impl;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one at a time per key.
 * <p>
 * Each key owns a tail gate. A new task starts only once the previous task for the same key
 * has finished, successfully or not; tasks for different keys never wait on each other. The
 * entry for a key is dropped once its last queued task completes. The gate is released when
 * the task itself finishes, not when the caller's future does.
 * </p>
 */
class SessionSerializer {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, gate);
        CompletableFuture<Void> predecessor = previous == null ? CompletableFuture.completedFuture(null) : previous;

        CompletableFuture<T> inner = predecessor.thenCompose(ignored -> run(task));
        inner.whenComplete((value, error) -> {
            tails.remove(key, gate);
            gate.complete(null);
        });
        // Callers get a dependent copy; cancelling or timing it out leaves the gate held until the task ends.
        return inner.thenApply(Function.identity());
    }

    int pendingKeys() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> task) {
        try {
            return task.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}

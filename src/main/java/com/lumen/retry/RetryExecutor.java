package com.lumen.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}.
 * <p>
 * Each attempt is a fresh {@link Mono} over the operation's future, retried with
 * {@code retryWhen}. Waits between attempts are {@code Mono.delay} timers on the given
 * {@link Scheduler}, so a backing-off call holds no thread.
 * </p>
 * <p>
 * Cancelling the returned future cancels the subscription: a pending wait is disposed, the
 * in-flight attempt's future is cancelled, and no further attempt is started.
 * </p>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Scheduler scheduler;

    public RetryExecutor(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Executes {@code operation}, retrying transient failures.
     *
     * @param operation Produces a fresh attempt each time it is invoked; must be safe to repeat.
     * @param policy    Attempt budget, backoff and failure classification.
     * @return A future with the first successful value, or failed with a {@link RetryExhaustedException}.
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.fromFuture(invoke(operation));
                })
                .doOnSuccess(value -> {
                    if (attempts.get() > 1) {
                        log.info("Operation succeeded on attempt {}/{}", attempts.get(), policy.maxAttempts());
                    }
                })
                .retryWhen(backoff(policy))
                .toFuture();
    }

    private Retry backoff(RetryPolicy policy) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            int attempt = (int) signal.totalRetries() + 1;
            Throwable failure = unwrap(signal.failure());
            if (!policy.isRetryable(failure)) {
                log.debug("Non-retryable failure on attempt {}: {}", attempt, failure.getMessage());
                return Mono.error(new RetryExhaustedException(attempt, FailureClass.NON_RETRYABLE, failure));
            }
            if (attempt >= policy.maxAttempts()) {
                log.error("Giving up after {} attempts: {}", attempt, failure.getMessage());
                return Mono.error(new RetryExhaustedException(attempt, FailureClass.RETRYABLE, failure));
            }
            Duration delay = policy.delayAfterAttempt(attempt);
            log.warn("Attempt {}/{} failed ({}). Retrying in {} ms",
                    attempt, policy.maxAttempts(), failure.getMessage(), delay.toMillis());
            return Mono.delay(delay, scheduler);
        }));
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

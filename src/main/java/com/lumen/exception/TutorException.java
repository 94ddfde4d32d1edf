package com.lumen.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type of every classified failure surfaced by the tutoring core.
 */
public abstract class TutorException extends RuntimeException {

    private final ErrorKind kind;

    protected TutorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TutorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers that
     * {@link java.util.concurrent.CompletableFuture} adds around a failure.
     *
     * @param throwable The failure as observed by a future stage.
     * @return The innermost non-wrapper throwable.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

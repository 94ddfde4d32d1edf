package com.lumen.exception;

/**
 * The training backend could not serve a request.
 * <p>
 * {@link #isRecoverable()} is {@code true} when transient failures exhausted the retry budget,
 * and {@code false} when the backend rejected the call outright (e.g. a 400 or an unreadable body).
 * </p>
 */
public class UpstreamUnavailableException extends TutorException {

    private final int attempts;
    private final boolean recoverable;

    public UpstreamUnavailableException(String message, int attempts, boolean recoverable, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
        this.attempts = attempts;
        this.recoverable = recoverable;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}

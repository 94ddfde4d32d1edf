package com.lumen.retry;

/**
 * Terminal failure of an operation run through {@link RetryExecutor}.
 * <p>
 * Carries the number of attempts made and whether the budget ran out on a transient
 * failure or the operation hit a failure that was never worth retrying. The last
 * failure is the cause.
 * </p>
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;
    private final FailureClass failureClass;

    public RetryExhaustedException(int attempts, FailureClass failureClass, Throwable lastFailure) {
        super("Operation failed after %d attempt(s) (%s): %s".formatted(
                attempts, failureClass, lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
        this.failureClass = failureClass;
    }

    public int getAttempts() {
        return attempts;
    }

    public FailureClass getFailureClass() {
        return failureClass;
    }
}

package com.lumen.retry;

import com.lumen.transport.TransportException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Tunables for {@link RetryExecutor}: attempt budget, exponential delay and the retryable-failure predicate.
 * <p>
 * The delay before attempt {@code n + 1} is {@code min(baseDelay * multiplier^(n - 1), maxDelay)}, with no jitter,
 * so with the defaults the waits are 1s, 2s, 4s and 8s across 5 attempts.
 * </p>
 *
 * @param maxAttempts Total attempts including the first, at least 1.
 * @param baseDelay   Wait after the first failed attempt.
 * @param maxDelay    Upper bound of any single wait.
 * @param multiplier  Exponential growth base, at least 1.0.
 * @param retryable   Decides whether a failure is worth another attempt.
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          Duration maxDelay,
                          double multiplier,
                          Predicate<Throwable> retryable) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        Objects.requireNonNull(retryable, "retryable");
    }

    public static RetryPolicy defaults() {
        return of(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MULTIPLIER);
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, RetryPolicy::isTransient);
    }

    public RetryPolicy withRetryable(Predicate<Throwable> predicate) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, predicate);
    }

    /**
     * Computes the wait that follows a failed attempt.
     *
     * @param attempt The 1-based number of the attempt that just failed.
     * @return The delay before the next attempt, capped at {@link #maxDelay()}.
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, got " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean isRetryable(Throwable failure) {
        return retryable.test(failure);
    }

    /**
     * Default classification: connection errors, timeouts, 5xx and 429 responses are transient;
     * everything else (4xx, validation, parsing) is not.
     */
    public static boolean isTransient(Throwable failure) {
        if (failure instanceof TransportException transportException) {
            return transportException.isRetryable();
        }
        return failure instanceof TimeoutException;
    }
}

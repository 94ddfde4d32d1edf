package com.lumen.transport;

/**
 * A failed HTTP exchange, classified for the retry layer.
 * <p>
 * Connection errors, timeouts, 5xx and 429 responses are {@link Kind#RETRYABLE};
 * other non-2xx responses are {@link Kind#NON_RETRYABLE}.
 * </p>
 */
public class TransportException extends RuntimeException {

    public enum Kind {
        RETRYABLE,
        NON_RETRYABLE
    }

    /** Status code used when no HTTP response was received at all. */
    public static final int NO_RESPONSE = -1;

    private final Kind kind;
    private final int statusCode;

    public TransportException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static TransportException forStatus(int statusCode, String method, String url) {
        Kind kind = statusCode >= 500 || statusCode == 429 ? Kind.RETRYABLE : Kind.NON_RETRYABLE;
        return new TransportException(kind, statusCode,
                "%s %s failed with code %d".formatted(method, url, statusCode), null);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}

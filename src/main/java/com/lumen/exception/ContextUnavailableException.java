package com.lumen.exception;

/**
 * A session could not be started because its context could not be fetched.
 * <p>
 * The cause is the classified gateway failure, so callers can still tell a missing
 * user or topic ({@link ErrorKind#NOT_FOUND}) from an unreachable backend.
 * </p>
 */
public class ContextUnavailableException extends TutorException {

    public ContextUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CONTEXT_UNAVAILABLE, message, cause);
    }

    /**
     * @return The kind of the underlying gateway failure, or {@link ErrorKind#UPSTREAM_UNAVAILABLE}
     *         when the cause is not classified.
     */
    public ErrorKind getUpstreamKind() {
        return getCause() instanceof TutorException tutorException
                ? tutorException.getKind()
                : ErrorKind.UPSTREAM_UNAVAILABLE;
    }
}

package com.lumen.exception;

/**
 * An active session already exists for the requested user, topic and course.
 */
public class SessionConflictException extends TutorException {

    private final String existingSessionId;

    public SessionConflictException(String existingSessionId) {
        super(ErrorKind.CONFLICT, "An active session already exists: " + existingSessionId);
        this.existingSessionId = existingSessionId;
    }

    public String getExistingSessionId() {
        return existingSessionId;
    }
}

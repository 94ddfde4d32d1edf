package com.lumen.exception;

import com.lumen.model.SessionStatus;

/**
 * Input was sent to a session that is already completed or abandoned.
 */
public class SessionNotActiveException extends TutorException {

    private final SessionStatus status;

    public SessionNotActiveException(String sessionId, SessionStatus status) {
        super(ErrorKind.SESSION_NOT_ACTIVE, "Session " + sessionId + " is " + status + " and accepts no more messages");
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}

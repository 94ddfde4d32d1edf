package com.lumen.exception;

/**
 * A referenced user, topic or session does not exist. Retrying does not help.
 */
public class NotFoundException extends TutorException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}

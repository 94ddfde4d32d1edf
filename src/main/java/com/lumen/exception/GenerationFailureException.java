package com.lumen.exception;

/**
 * The AI collaborator failed to produce a reply after its retry budget.
 */
public class GenerationFailureException extends TutorException {

    public GenerationFailureException(String message, Throwable cause) {
        super(ErrorKind.GENERATION_FAILURE, message, cause);
    }
}

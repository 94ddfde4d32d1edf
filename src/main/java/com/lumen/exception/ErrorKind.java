package com.lumen.exception;

/**
 * Classification of tutoring failures, used by callers to decide between
 * "try again", "this session is over" and "this does not exist".
 */
public enum ErrorKind {
    UPSTREAM_UNAVAILABLE,
    NOT_FOUND,
    CONFLICT,
    SESSION_NOT_ACTIVE,
    CONTEXT_UNAVAILABLE,
    GENERATION_FAILURE
}

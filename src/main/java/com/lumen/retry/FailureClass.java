package com.lumen.retry;

/**
 * How the last failure of a retried operation was classified.
 */
public enum FailureClass {
    /** Transient failure; the retry budget ran out. The caller may try again later. */
    RETRYABLE,
    /** Permanent failure; retrying was skipped. */
    NON_RETRYABLE
}

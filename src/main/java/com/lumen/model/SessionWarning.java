package com.lumen.model;

/**
 * Degraded outcomes attached to an otherwise successful result.
 */
public enum SessionWarning {
    /** The session completed locally but the training backend could not be told. */
    COMPLETION_NOTIFICATION_FAILED,
    /** The session started but the AI produced no opening message. */
    OPENING_MESSAGE_UNAVAILABLE
}

package com.lumen.model;

/**
 * Lifecycle status of a tutoring {@link Session}.
 * <p>
 * Only {@link #ACTIVE} accepts input. {@link #COMPLETED} and {@link #ABANDONED} are terminal:
 * once reached, a session never moves again.
 * </p>
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}

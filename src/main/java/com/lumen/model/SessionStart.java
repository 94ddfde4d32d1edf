package com.lumen.model;

import java.util.Set;

/**
 * Result of starting a session.
 *
 * @param session        The newly created, active session.
 * @param openingMessage The tutor's first message, or {@code null} when it could not be generated.
 * @param warnings       Degraded outcomes, empty on a clean start.
 */
public record SessionStart(Session session, String openingMessage, Set<SessionWarning> warnings) {

    public SessionStart {
        warnings = Set.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

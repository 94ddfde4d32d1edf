package com.lumen.model;

import java.time.Instant;
import java.util.Set;

/**
 * The tutor's answer to one learner message.
 *
 * @param session          Session state after the message was processed.
 * @param assistantMessage Reply text, never containing the completion marker.
 * @param topicCompleted   Whether this reply completed the topic.
 * @param timestamp        When the reply was recorded.
 * @param warnings         Degraded outcomes, e.g. a completion notification that did not reach the backend.
 */
public record MessageReply(Session session,
                           String assistantMessage,
                           boolean topicCompleted,
                           Instant timestamp,
                           Set<SessionWarning> warnings) {

    public MessageReply {
        warnings = Set.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

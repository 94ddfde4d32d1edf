package com.lumen.service.api;

import com.lumen.model.SessionContext;
import com.lumen.model.TopicSpec;
import com.lumen.model.UserContext;

/**
 * Turns topic and learner context into the system instruction of a tutoring session.
 * <p>
 * Implementations are pure: the same inputs always produce the same prompt. Whatever the
 * template looks like, the resulting prompt always tells the AI which completion marker to emit.
 * </p>
 */
public interface PromptBuilder {

    /**
     * Builds the system instruction from freshly fetched backend data.
     *
     * @param topic            The topic being tutored; its template drives the prompt layout.
     * @param user             The learner's context.
     * @param completionMarker The literal token the AI must emit once the topic is mastered.
     * @return The complete system instruction.
     */
    default String build(TopicSpec topic, UserContext user, String completionMarker) {
        return build(SessionContext.capture(topic, user), completionMarker);
    }

    /**
     * Builds the system instruction from a captured session context.
     */
    String build(SessionContext context, String completionMarker);
}

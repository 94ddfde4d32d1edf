package com.lumen.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the externally sourced facts a session's system prompt was built from.
 * <p>
 * Captured once when the session starts and never refreshed, so the prompt of a running
 * session is unaffected by later changes on the training backend.
 * </p>
 */
public record SessionContext(String userLevel,
                             List<Long> completedTopicIds,
                             List<String> struggleTopics,
                             String courseTitle,
                             String topicTitle,
                             String topicDescription,
                             String learningObjectives,
                             String promptTemplate) {

    public SessionContext {
        completedTopicIds = withoutNulls(completedTopicIds);
        struggleTopics = withoutNulls(struggleTopics);
    }

    public static SessionContext capture(TopicSpec topic, UserContext user) {
        return new SessionContext(
                user.userLevel(),
                user.completedTopicIds(),
                user.struggleTopics(),
                topic.courseTitle(),
                topic.title(),
                topic.description(),
                topic.learningObjectives(),
                topic.promptTemplate());
    }

    // The backend occasionally sends null entries inside these arrays.
    private static <T> List<T> withoutNulls(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
}

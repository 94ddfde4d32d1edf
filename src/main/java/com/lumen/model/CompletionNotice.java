package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of the topic-completion notification pushed to the training backend.
 */
public record CompletionNotice(@JsonProperty("UserId") long userId,
                               @JsonProperty("TopicId") long topicId,
                               @JsonProperty("CourseId") long courseId,
                               @JsonProperty("SessionId") String sessionId,
                               @JsonProperty("CompletedAt") Instant completedAt) {
}

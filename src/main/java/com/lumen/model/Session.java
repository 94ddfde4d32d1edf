package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * One tutoring conversation tied to a user, topic and course.
 * <p>
 * Sessions are immutable values; a status change produces a new instance via
 * {@link #complete(Instant)} or {@link #abandon()}. The record enforces that
 * {@code completedAt} is present exactly when the status is {@link SessionStatus#COMPLETED}.
 * </p>
 *
 * @param id          Opaque session identifier.
 * @param userId      Owning user, as known to the training backend.
 * @param topicId     Topic being tutored.
 * @param courseId    Course the topic belongs to.
 * @param status      Current lifecycle status.
 * @param startedAt   Creation instant.
 * @param completedAt Completion instant, {@code null} unless completed.
 */
public record Session(String id,
                      long userId,
                      long topicId,
                      long courseId,
                      SessionStatus status,
                      Instant startedAt,
                      Instant completedAt) {

    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        if ((status == SessionStatus.COMPLETED) != (completedAt != null)) {
            throw new IllegalArgumentException(
                    "completedAt must be set exactly when status is COMPLETED (status=" + status + ")");
        }
    }

    public static Session start(String id, long userId, long topicId, long courseId, Instant startedAt) {
        return new Session(id, userId, topicId, courseId, SessionStatus.ACTIVE, startedAt, null);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public Session complete(Instant at) {
        requireActive(SessionStatus.COMPLETED);
        return new Session(id, userId, topicId, courseId, SessionStatus.COMPLETED, startedAt, at);
    }

    public Session abandon() {
        requireActive(SessionStatus.ABANDONED);
        return new Session(id, userId, topicId, courseId, SessionStatus.ABANDONED, startedAt, null);
    }

    private void requireActive(SessionStatus target) {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Cannot move session " + id + " from " + status + " to " + target);
        }
    }
}

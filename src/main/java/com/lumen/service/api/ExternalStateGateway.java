package com.lumen.service.api;

import com.lumen.model.TopicSpec;
import com.lumen.model.UserContext;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Typed access to the training backend that owns users, topics and progress.
 * <p>
 * Every operation except {@link #checkHealth()} is retried on transient failure. Futures fail with
 * {@link com.lumen.exception.NotFoundException} when the backend reports the referenced entity
 * does not exist (never retried), and with {@link com.lumen.exception.UpstreamUnavailableException}
 * when the backend stays unreachable or rejects the call.
 * </p>
 */
public interface ExternalStateGateway {

    /**
     * Fetches the learner's level, completed topics and struggle areas.
     *
     * @param userId The user's id on the training backend.
     * @return The user's context.
     */
    CompletableFuture<UserContext> fetchUserContext(long userId);

    /**
     * Fetches the topic definition, including its prompt template and course title.
     *
     * @param topicId The topic's id on the training backend.
     * @return The topic specification.
     */
    CompletableFuture<TopicSpec> fetchTopicSpec(long topicId);

    /**
     * Tells the backend that a topic was completed in a session.
     * <p>
     * Delivery is at-least-once: a retried notification may reach the backend more than once,
     * and the backend is expected to treat duplicates idempotently.
     * </p>
     *
     * @return A future completing when the backend acknowledged the notification.
     */
    CompletableFuture<Void> notifyCompletion(long userId, long topicId, long courseId,
                                             String sessionId, Instant completedAt);

    /**
     * Probes the backend once, without retries.
     *
     * @return A future with {@code true} if the backend answered with a 2xx status.
     */
    CompletableFuture<Boolean> checkHealth();
}

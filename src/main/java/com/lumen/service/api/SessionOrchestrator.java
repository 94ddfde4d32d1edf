package com.lumen.service.api;

import com.lumen.model.MessageReply;
import com.lumen.model.Session;
import com.lumen.model.SessionDetails;
import com.lumen.model.SessionStart;

import java.util.concurrent.CompletableFuture;

/**
 * Manages the lifecycle of tutoring sessions.
 * <p>
 * This service is the central controller of the tutoring experience. It is responsible for:
 * <ul>
 *   <li>Starting sessions from context fetched off the training backend.</li>
 *   <li>Relaying learner messages to the AI within a bounded conversation window.</li>
 *   <li>Detecting topic completion and reporting it back to the training backend.</li>
 *   <li>Abandoning sessions on request.</li>
 * </ul>
 * Failures are surfaced as {@link com.lumen.exception.TutorException} subclasses inside the
 * returned futures. Calls on the same session are processed one at a time; calls on different
 * sessions proceed independently.
 * </p>
 */
public interface SessionOrchestrator {

    /**
     * Starts a new session for a learner on a topic.
     *
     * @return The active session and the tutor's opening message.
     * @throws com.lumen.exception.SessionConflictException    (in the future) if the learner already
     *                                                          has an active session on this topic.
     * @throws com.lumen.exception.ContextUnavailableException (in the future) if the user or topic could
     *                                                          not be fetched; no session is created.
     */
    CompletableFuture<SessionStart> start(long userId, long topicId, long courseId);

    /**
     * Sends a learner message and returns the tutor's reply.
     * <p>
     * If the reply completes the topic, the session becomes completed before this call returns,
     * and the backend is notified. A failed notification does not fail the call; it is reported
     * as a warning on the reply.
     * </p>
     */
    CompletableFuture<MessageReply> postMessage(String sessionId, String userText);

    /**
     * Abandons an active session. Abandoning a session that already ended is a no-op.
     *
     * @return The session as it stands after the call.
     */
    CompletableFuture<Session> abandon(String sessionId);

    /**
     * @return The session, its captured context and its learner-visible history.
     */
    CompletableFuture<SessionDetails> getSession(String sessionId);
}

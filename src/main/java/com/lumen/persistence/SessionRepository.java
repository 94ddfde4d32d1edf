package com.lumen.persistence;

import com.lumen.model.Session;
import com.lumen.model.SessionContext;
import com.lumen.model.SessionStatus;
import com.lumen.model.Turn;
import com.lumen.model.TurnRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for sessions, their captured context and their append-only turns.
 * <p>
 * Sessions are never deleted. Status changes go through {@link #updateStatus}, which only
 * applies when the stored status still matches the caller's expectation.
 * </p>
 */
public interface SessionRepository {

    /**
     * Stores a new session together with its context.
     *
     * @throws IllegalStateException if a session with the same id already exists.
     */
    void insert(Session session, SessionContext context);

    Optional<Session> findById(String sessionId);

    Optional<SessionContext> findContext(String sessionId);

    /**
     * @return The active session for the given triple, if any.
     */
    Optional<Session> findActive(long userId, long topicId, long courseId);

    /**
     * Replaces the stored session with {@code updated} if its status is still {@code expected}.
     *
     * @return {@code true} if the update was applied.
     */
    boolean updateStatus(String sessionId, SessionStatus expected, Session updated);

    /**
     * Appends a turn, assigning the next sequence number.
     *
     * @throws com.lumen.exception.NotFoundException if the session does not exist.
     */
    Turn appendTurn(String sessionId, TurnRole role, String content, Instant at);

    /**
     * @return All turns of the session in sequence order; empty if the session is unknown.
     */
    List<Turn> findTurns(String sessionId);
}

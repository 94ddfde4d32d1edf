package com.lumen.service.api;

import com.lumen.model.Turn;
import com.lumen.model.TurnRole;

import java.util.List;

/**
 * Append-only, ordered conversation history of each session.
 */
public interface ConversationStore {

    /**
     * Appends a turn at the end of the session's conversation.
     *
     * @return The stored turn with its assigned sequence number.
     */
    Turn append(String sessionId, TurnRole role, String content);

    /**
     * Returns the bounded window of turns to send to the AI.
     * <p>
     * The system turn is always first. If more than {@code maxTurns - 1} other turns exist,
     * only the most recent {@code maxTurns - 1} of them follow it, oldest first.
     * </p>
     *
     * @param maxTurns Window size including the system turn; must be at least 1.
     */
    List<Turn> readForContext(String sessionId, int maxTurns);

    /**
     * @return Every turn of the session in order.
     */
    List<Turn> readAll(String sessionId);
}

package com.lumen.model;

import java.time.Instant;

/**
 * An ordered, append-only entry in a session's conversation.
 *
 * @param sessionId Owning session.
 * @param sequence  Zero-based position; the SYSTEM turn is always 0.
 * @param role      Author of the turn.
 * @param content   Text exactly as stored.
 * @param timestamp Append instant.
 */
public record Turn(String sessionId, long sequence, TurnRole role, String content, Instant timestamp) {

    public Turn withContent(String visibleContent) {
        return new Turn(sessionId, sequence, role, visibleContent, timestamp);
    }
}

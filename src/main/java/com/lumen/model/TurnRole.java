package com.lumen.model;

import java.util.Locale;

/**
 * Author of a {@link Turn} in a session's conversation.
 */
public enum TurnRole {
    SYSTEM,
    USER,
    ASSISTANT;

    /**
     * @return The lowercase role name used by OpenAI-compatible chat payloads.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

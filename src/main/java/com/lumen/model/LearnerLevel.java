package com.lumen.model;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed set of proficiency levels the tutor adapts to, with their prompt renderings.
 * <p>
 * The training backend reports free-form level labels; {@link #fromLabel(String)} folds the
 * known synonyms onto this enumeration so the prompt never echoes an arbitrary label.
 * </p>
 */
public enum LearnerLevel {
    BEGINNER("iniciante"),
    INTERMEDIATE("intermediário"),
    ADVANCED("avançado");

    /** Rendering used when the backend reports no level at all. */
    public static final String UNKNOWN_RENDERING = "iniciante a intermediário";

    private static final Map<String, LearnerLevel> LABELS = Map.of(
            "beginner", BEGINNER,
            "novice", BEGINNER,
            "intermediate", INTERMEDIATE,
            "advanced", ADVANCED,
            "expert", ADVANCED
    );

    private final String rendering;

    LearnerLevel(String rendering) {
        this.rendering = rendering;
    }

    public String rendering() {
        return rendering;
    }

    /**
     * Maps a backend label onto a level. Unrecognized labels fall back to {@link #INTERMEDIATE}.
     */
    public static LearnerLevel fromLabel(String label) {
        return LABELS.getOrDefault(label.trim().toLowerCase(Locale.ROOT), INTERMEDIATE);
    }

    /**
     * @return The prompt rendering for a backend label, or {@link #UNKNOWN_RENDERING} when it is blank.
     */
    public static String render(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN_RENDERING;
        }
        return fromLabel(label).rendering();
    }
}

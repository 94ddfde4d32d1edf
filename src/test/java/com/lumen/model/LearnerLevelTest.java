package com.lumen.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LearnerLevelTest {

    @ParameterizedTest
    @CsvSource({
            "beginner, iniciante",
            "Novice, iniciante",
            "INTERMEDIATE, intermediário",
            "advanced, avançado",
            "expert, avançado",
            "guru, intermediário"
    })
    void testRender(String label, String expected) {
        assertThat(LearnerLevel.render(label)).isEqualTo(expected);
    }

    @Test
    void testMissingLevel() {
        assertThat(LearnerLevel.render(null)).isEqualTo(LearnerLevel.UNKNOWN_RENDERING);
        assertThat(LearnerLevel.render(" ")).isEqualTo("iniciante a intermediário");
    }
}

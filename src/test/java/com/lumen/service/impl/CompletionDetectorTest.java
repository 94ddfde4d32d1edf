package com.lumen.service.impl;

import com.lumen.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionDetectorTest {

    private static final String MARKER = "{TOPIC_COMPLETED}";

    private final CompletionDetector detector = new CompletionDetector();

    @Test
    @DisplayName("Detects a trailing marker and strips it")
    void testTrailingMarker() {
        DetectionResult result = detector.detect("Great job! {TOPIC_COMPLETED}", MARKER);

        assertThat(result.completed()).isTrue();
        assertThat(result.cleanedText()).isEqualTo("Great job!");
    }

    @Test
    @DisplayName("Collapses the whitespace around every occurrence to one space")
    void testMarkerInTheMiddle() {
        DetectionResult result = detector.detect("Well done.\n\n{TOPIC_COMPLETED}\n\nSee you {TOPIC_COMPLETED} soon", MARKER);

        assertThat(result.completed()).isTrue();
        assertThat(result.cleanedText()).isEqualTo("Well done. See you soon");
        assertThat(result.cleanedText()).doesNotContain(MARKER);
    }

    @Test
    @DisplayName("Stripping never leaves a marker behind")
    void testNestedMarker() {
        DetectionResult result = detector.detect("Done {TOPIC_{TOPIC_COMPLETED}COMPLETED}", MARKER);

        assertThat(result.completed()).isTrue();
        assertThat(result.cleanedText()).doesNotContain(MARKER);
    }

    @Test
    @DisplayName("Text without the marker is returned unchanged")
    void testNoMarker() {
        DetectionResult result = detector.detect("  Keep going!  ", MARKER);

        assertThat(result.completed()).isFalse();
        assertThat(result.cleanedText()).isEqualTo("  Keep going!  ");
    }

    @Test
    @DisplayName("Cleaned text never reports completion again")
    void testIdempotent() {
        DetectionResult first = detector.detect("Perfect {TOPIC_COMPLETED}", MARKER);
        DetectionResult second = detector.detect(first.cleanedText(), MARKER);

        assertThat(second.completed()).isFalse();
        assertThat(second.cleanedText()).isEqualTo(first.cleanedText());
    }

    @Test
    @DisplayName("Null text and regex characters in the marker are handled")
    void testEdgeCases() {
        assertThat(detector.detect(null, MARKER)).isEqualTo(new DetectionResult("", false));
        assertThat(detector.detect("All set $DONE$.", "$DONE$")).isEqualTo(new DetectionResult("All set .", true));
        assertThat(detector.strip("Only the marker {TOPIC_COMPLETED}", MARKER)).isEqualTo("Only the marker");
    }
}

package com.lumen.service.impl;

import com.lumen.model.DetectionResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Scans AI replies for the completion marker and strips it before the reply reaches the learner.
 * <p>
 * Pure and total: it never throws. Text without the marker comes back unchanged; otherwise every
 * occurrence is removed, the whitespace around each occurrence collapses to a single space and the
 * result is trimmed. Cleaning is repeated until no occurrence is left, so running the detector on
 * its own output always reports {@code completed == false}.
 * </p>
 */
@Component
public class CompletionDetector {

    public DetectionResult detect(String aiText, String marker) {
        if (aiText == null) {
            return new DetectionResult("", false);
        }
        if (marker == null || marker.isBlank() || !aiText.contains(marker)) {
            return new DetectionResult(aiText, false);
        }

        Pattern occurrence = Pattern.compile("\\s*" + Pattern.quote(marker) + "\\s*");
        String cleaned = aiText;
        while (cleaned.contains(marker)) {
            cleaned = occurrence.matcher(cleaned).replaceAll(" ");
        }
        return new DetectionResult(cleaned.trim(), true);
    }

    /**
     * @return {@code text} as the learner should see it.
     */
    public String strip(String text, String marker) {
        return detect(text, marker).cleanedText();
    }
}

package com.lumen.model;

/**
 * Outcome of scanning an AI reply for the completion marker.
 *
 * @param cleanedText The reply with every marker occurrence removed.
 * @param completed   Whether the marker was present.
 */
public record DetectionResult(String cleanedText, boolean completed) {
}

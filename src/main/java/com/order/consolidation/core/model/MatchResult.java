package com.order.consolidation.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of matching one product mention against a catalog snapshot.
 * Candidates are ranked by descending confidence; {@code bestMatch} is the first one, if any.
 */
public record MatchResult(
        String query,
        List<MatchCandidate> candidates,
        MatchCandidate bestMatch,
        ConfidenceLevel confidenceLevel,
        boolean requiresClarification,
        String suggestedQuestion,
        Duration processingTime
) {
    public MatchResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        Objects.requireNonNull(confidenceLevel, "confidenceLevel is required");
        processingTime = processingTime != null ? processingTime : Duration.ZERO;
    }

    public boolean hasMatch() {
        return bestMatch != null;
    }

    /**
     * Returns the best candidate's confidence, or 0.0 when nothing matched.
     */
    public double bestConfidence() {
        return bestMatch != null ? bestMatch.confidence() : 0.0;
    }
}

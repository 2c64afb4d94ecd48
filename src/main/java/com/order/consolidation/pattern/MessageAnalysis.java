package com.order.consolidation.pattern;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated pattern analysis of one message.
 */
public record MessageAnalysis(
        String originalText,
        boolean hasOrderIntent,
        double orderIntentConfidence,
        boolean hasClosingPattern,
        double closingConfidence,
        boolean hasCorrection,
        double correctionConfidence,
        List<ExtractedItem> extractedItems,
        double overallConfidence,
        SuggestedAction suggestedAction,
        List<PatternMatch> allMatches
) {
    public MessageAnalysis {
        originalText = originalText != null ? originalText : "";
        extractedItems = extractedItems != null ? List.copyOf(extractedItems) : List.of();
        allMatches = allMatches != null ? List.copyOf(allMatches) : List.of();
        Objects.requireNonNull(suggestedAction, "suggestedAction is required");
        if (overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public boolean hasItems() {
        return !extractedItems.isEmpty();
    }
}

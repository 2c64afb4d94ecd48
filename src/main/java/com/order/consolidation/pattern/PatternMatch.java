package com.order.consolidation.pattern;

import java.util.Map;
import java.util.Objects;

/**
 * A single regex hit within a message.
 *
 * @param type          the pattern family that matched
 * @param confidence    weight contributed by this hit
 * @param matchedText   the matched substring
 * @param start         start offset in the original text, inclusive
 * @param end           end offset in the original text, exclusive
 * @param extractedData family-specific values (strength, quantity, unit, product)
 */
public record PatternMatch(
        PatternType type,
        double confidence,
        String matchedText,
        int start,
        int end,
        Map<String, String> extractedData
) {
    public PatternMatch {
        Objects.requireNonNull(type, "type is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
        }
        extractedData = extractedData != null ? Map.copyOf(extractedData) : Map.of();
    }
}

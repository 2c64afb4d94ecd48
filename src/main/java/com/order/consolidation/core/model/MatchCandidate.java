package com.order.consolidation.core.model;

import java.util.Objects;

/**
 * One catalog entry proposed for a free-text product mention.
 */
public record MatchCandidate(
        CatalogEntry entry,
        MatchType matchType,
        double confidence,
        String matchedText
) {
    public MatchCandidate {
        Objects.requireNonNull(entry, "entry is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public String productId() {
        return entry.id();
    }

    public String productName() {
        return entry.name();
    }
}

package com.order.consolidation.pattern;

import java.util.List;

/**
 * Verdict of one detector family: whether it fired, its aggregated confidence and the hits.
 */
public record PatternDetection(boolean detected, double confidence, List<PatternMatch> matches) {

    public PatternDetection {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static PatternDetection none() {
        return new PatternDetection(false, 0.0, List.of());
    }
}

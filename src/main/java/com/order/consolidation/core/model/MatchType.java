package com.order.consolidation.core.model;

/**
 * Matching tier that produced a candidate, with the base confidence of that tier.
 * Tiers are listed in the order they are tried.
 */
public enum MatchType {
    EXACT(1.0),
    ALIAS(0.95),
    MISSPELLING(0.90),
    KEYWORD(0.85),
    TRAINING(0.80),
    FUZZY_HIGH(0.75),
    FUZZY_MED(0.60),
    FUZZY_LOW(0.45);

    private final double baseConfidence;

    MatchType(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double baseConfidence() {
        return baseConfidence;
    }
}

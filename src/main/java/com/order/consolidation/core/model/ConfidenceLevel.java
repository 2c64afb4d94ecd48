package com.order.consolidation.core.model;

/**
 * Coarse bucket derived from the top candidate confidence of a match.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW,
    NONE
}

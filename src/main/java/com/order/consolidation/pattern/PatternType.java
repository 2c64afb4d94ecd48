package com.order.consolidation.pattern;

/**
 * Kinds of text pattern the detector recognizes.
 */
public enum PatternType {
    ORDER_INTENT,
    CLOSING,
    CORRECTION,
    QUANTITY,
    PRODUCT
}

package com.order.consolidation.continuation;

/**
 * How a continuation verdict was reached.
 */
public enum DetectionMethod {
    /** Explicit or implicit continuation phrases, or the absence of any open order. */
    RULES,
    /** A product request arriving shortly after a pending order. */
    TEMPORAL_RULES,
    /** The recent-order lookup failed. */
    ERROR
}

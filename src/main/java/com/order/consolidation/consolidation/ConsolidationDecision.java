package com.order.consolidation.consolidation;

/**
 * What to do with an order-related message relative to the conversation's open order.
 */
public enum ConsolidationDecision {
    /** Add to the existing order. */
    CONSOLIDATE,
    /** Treat as a separate order. */
    NEW_ORDER,
    /** Not enough signal yet; wait for follow-ups. */
    WAIT_MORE,
    /** The current order is finished and should be created. */
    ORDER_COMPLETE
}

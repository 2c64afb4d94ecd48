package com.order.consolidation.core.model;

/**
 * Status of a persisted order as seen by the continuation checks.
 * Only PENDING orders may be continued; the others are hard boundaries.
 */
public enum OrderStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}

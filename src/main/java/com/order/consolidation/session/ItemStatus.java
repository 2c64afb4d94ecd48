package com.order.consolidation.session;

/**
 * Status of a session item. Items are never deleted, only cancelled.
 */
public enum ItemStatus {
    ACTIVE,
    CANCELLED
}

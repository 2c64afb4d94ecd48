package com.order.consolidation.session;

/**
 * Types of entries in a session's event log.
 */
public enum SessionEventType {
    SESSION_STARTED,
    MESSAGE_ADDED,
    ITEM_EXTRACTED,
    ITEM_CANCELLED,
    STATUS_CHANGED,
    SESSION_EXTENDED,
    SESSION_CONSOLIDATED,
    SESSION_CLOSED,
    ORDER_CREATED
}

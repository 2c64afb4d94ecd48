package com.order.consolidation.api;

/**
 * What processing a message did to the conversation's order session.
 */
public enum SessionAction {
    /** A new session was started. */
    STARTED,
    /** The open session took the message. */
    EXTENDED,
    /** The open session was consolidated and closed. */
    CLOSED,
    /** The open session was closed and a new one started with the message. */
    ROLLED_OVER,
    /** No session changed. */
    NONE
}

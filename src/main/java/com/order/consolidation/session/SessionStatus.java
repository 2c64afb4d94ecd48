package com.order.consolidation.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an order session.
 *
 * <p>Legal transitions: ACTIVE to COLLECTING, COLLECTING to REVIEWING, and any open state
 * to CLOSED. CLOSED is terminal.</p>
 */
public enum SessionStatus {
    ACTIVE,
    COLLECTING,
    REVIEWING,
    CLOSED;

    /**
     * Returns true if a session in this state may move to {@code next}.
     */
    public boolean canTransitionTo(SessionStatus next) {
        return allowedTargets().contains(next);
    }

    /**
     * Returns true for every state except CLOSED.
     */
    public boolean isOpen() {
        return this != CLOSED;
    }

    /**
     * Returns true for the states in which a session accepts new messages and items.
     */
    public boolean isCollecting() {
        return this == ACTIVE || this == COLLECTING;
    }

    private Set<SessionStatus> allowedTargets() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(COLLECTING, CLOSED);
            case COLLECTING -> EnumSet.of(REVIEWING, CLOSED);
            case REVIEWING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(SessionStatus.class);
        };
    }
}

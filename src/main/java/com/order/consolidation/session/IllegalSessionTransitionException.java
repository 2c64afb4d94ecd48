package com.order.consolidation.session;

/**
 * Thrown when a status change is not an edge of the session state machine.
 */
public class IllegalSessionTransitionException extends RuntimeException {

    private final SessionStatus from;
    private final SessionStatus to;

    public IllegalSessionTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Illegal transition " + from + " -> " + to + " for session " + sessionId);
        this.from = from;
        this.to = to;
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionStatus getTo() {
        return to;
    }
}

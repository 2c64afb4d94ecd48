package com.order.consolidation.session;

/**
 * Thrown when a session is created for a conversation that already has an open session.
 */
public class DuplicateSessionException extends RuntimeException {

    private final String conversationId;
    private final String existingSessionId;

    public DuplicateSessionException(String conversationId, String existingSessionId) {
        super("Conversation '" + conversationId + "' already has open session " + existingSessionId);
        this.conversationId = conversationId;
        this.existingSessionId = existingSessionId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getExistingSessionId() {
        return existingSessionId;
    }
}

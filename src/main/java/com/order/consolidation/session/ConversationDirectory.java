package com.order.consolidation.session;

import java.util.Optional;

/**
 * Resolves the customer behind a conversation.
 */
@FunctionalInterface
public interface ConversationDirectory {

    Optional<String> findCustomerId(String conversationId);

    /**
     * Remembers the customer seen on an inbound message. Read-only directories may ignore it.
     */
    default void register(String conversationId, String customerId) {
    }
}

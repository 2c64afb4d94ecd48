package com.order.consolidation.session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Conversation directory filled from the customer ids of inbound messages.
 */
public class InMemoryConversationDirectory implements ConversationDirectory {

    private final ConcurrentMap<String, String> customers = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findCustomerId(String conversationId) {
        return Optional.ofNullable(customers.get(conversationId));
    }

    @Override
    public void register(String conversationId, String customerId) {
        if (conversationId != null && customerId != null) {
            customers.put(conversationId, customerId);
        }
    }
}

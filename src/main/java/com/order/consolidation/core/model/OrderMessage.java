package com.order.consolidation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A previously received message of a conversation, as used for timing analysis.
 */
public record OrderMessage(
        String id,
        String conversationId,
        Instant createdAt,
        boolean orderRelated
) {
    public OrderMessage {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(conversationId, "conversationId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }
}

package com.order.consolidation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A customer message entering the engine.
 */
public record InboundMessage(
        String id,
        String conversationId,
        String customerId,
        String distributorId,
        String content,
        Instant receivedAt
) {
    public InboundMessage {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(conversationId, "conversationId is required");
        Objects.requireNonNull(receivedAt, "receivedAt is required");
        content = content != null ? content : "";
    }
}

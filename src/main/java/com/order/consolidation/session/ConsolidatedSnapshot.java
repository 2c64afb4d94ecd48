package com.order.consolidation.session;

import com.order.consolidation.core.model.OrderRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * The order request a session was consolidated into, stored on the session.
 */
public record ConsolidatedSnapshot(
        OrderRequest orderRequest,
        Instant consolidatedAt,
        int totalItems,
        int totalMessages
) {
    public ConsolidatedSnapshot {
        Objects.requireNonNull(orderRequest, "orderRequest is required");
        Objects.requireNonNull(consolidatedAt, "consolidatedAt is required");
    }
}

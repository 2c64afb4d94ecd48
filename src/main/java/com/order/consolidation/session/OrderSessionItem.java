package com.order.consolidation.session;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One product line collected into a session. Append-only: cancellation flips
 * {@code itemStatus}, the item itself is kept.
 */
public record OrderSessionItem(
        String id,
        String sessionId,
        int sequenceNumber,
        String productName,
        BigDecimal quantity,
        String unit,
        BigDecimal unitPrice,
        BigDecimal lineTotal,
        double confidence,
        String sourceMessageId,
        String originalText,
        String suggestedCatalogId,
        double matchingConfidence,
        ItemStatus itemStatus,
        String notes,
        Instant createdAt
) {
    public OrderSessionItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(productName, "productName is required");
        Objects.requireNonNull(quantity, "quantity is required");
        Objects.requireNonNull(sourceMessageId, "sourceMessageId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity must be non-negative");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (matchingConfidence < 0.0 || matchingConfidence > 1.0) {
            throw new IllegalArgumentException("Matching confidence must be between 0.0 and 1.0");
        }
        unit = unit != null ? unit : "units";
        itemStatus = itemStatus != null ? itemStatus : ItemStatus.ACTIVE;
    }

    public boolean isActive() {
        return itemStatus == ItemStatus.ACTIVE;
    }

    /**
     * Returns a cancelled copy carrying the given note.
     */
    public OrderSessionItem cancelled(String reason) {
        return new OrderSessionItem(id, sessionId, sequenceNumber, productName, quantity, unit, unitPrice,
                lineTotal, confidence, sourceMessageId, originalText, suggestedCatalogId, matchingConfidence,
                ItemStatus.CANCELLED, reason, createdAt);
    }

    /**
     * Creates a new ACTIVE item from a draft.
     */
    static OrderSessionItem fromDraft(String sessionId, int sequenceNumber, ItemDraft draft, Instant createdAt) {
        return new OrderSessionItem(UUID.randomUUID().toString(), sessionId, sequenceNumber,
                draft.productName(), draft.quantity(), draft.unit(), draft.unitPrice(), draft.lineTotal(),
                draft.confidence(), draft.sourceMessageId(), draft.originalText(), draft.suggestedCatalogId(),
                draft.matchingConfidence(), ItemStatus.ACTIVE, draft.notes(), createdAt);
    }
}

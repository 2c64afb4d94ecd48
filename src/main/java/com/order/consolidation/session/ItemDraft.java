package com.order.consolidation.session;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Values for a session item that does not exist yet.
 */
public record ItemDraft(
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
        String notes
) {
    public ItemDraft {
        Objects.requireNonNull(productName, "productName is required");
        Objects.requireNonNull(quantity, "quantity is required");
        Objects.requireNonNull(sourceMessageId, "sourceMessageId is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (matchingConfidence < 0.0 || matchingConfidence > 1.0) {
            throw new IllegalArgumentException("Matching confidence must be between 0.0 and 1.0");
        }
    }

    /**
     * A draft without catalog enrichment.
     */
    public static ItemDraft of(String productName, BigDecimal quantity, String unit, double confidence,
                               String sourceMessageId, String originalText) {
        return new ItemDraft(productName, quantity, unit, null, null, confidence, sourceMessageId,
                originalText, null, 0.0, null);
    }
}

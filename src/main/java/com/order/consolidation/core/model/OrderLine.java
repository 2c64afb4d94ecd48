package com.order.consolidation.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of a consolidated order request.
 */
public record OrderLine(
        String productName,
        BigDecimal quantity,
        String unit,
        BigDecimal unitPrice,
        BigDecimal lineTotal,
        double confidence,
        String originalText,
        String suggestedCatalogId,
        double matchingConfidence
) {
    public OrderLine {
        Objects.requireNonNull(productName, "productName is required");
        Objects.requireNonNull(quantity, "quantity is required");
        unitPrice = unitPrice != null ? unitPrice : BigDecimal.ZERO;
        lineTotal = lineTotal != null ? lineTotal : BigDecimal.ZERO;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (matchingConfidence < 0.0 || matchingConfidence > 1.0) {
            throw new IllegalArgumentException("Matching confidence must be between 0.0 and 1.0");
        }
    }
}

package com.order.consolidation.pattern;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A quantity and product phrase pulled out of a message, e.g. "2 kg de queso".
 */
public record ExtractedItem(
        BigDecimal quantity,
        String unit,
        String productName,
        double confidence,
        String originalText,
        int start,
        int end
) {
    public static final String DEFAULT_UNIT = "units";

    public ExtractedItem {
        Objects.requireNonNull(quantity, "quantity is required");
        Objects.requireNonNull(productName, "productName is required");
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity must be non-negative");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        unit = unit != null && !unit.isBlank() ? unit : DEFAULT_UNIT;
        originalText = originalText != null ? originalText : "";
    }
}

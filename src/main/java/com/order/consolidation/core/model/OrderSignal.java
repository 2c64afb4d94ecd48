package com.order.consolidation.core.model;

/**
 * Opaque order-relatedness verdict supplied by an external intent classifier.
 */
public record OrderSignal(boolean orderRelated, double confidence) {

    public OrderSignal {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public static OrderSignal orderRelated(double confidence) {
        return new OrderSignal(true, confidence);
    }

    public static OrderSignal notOrderRelated() {
        return new OrderSignal(false, 0.0);
    }
}

package com.order.consolidation.continuation;

import java.util.Objects;

/**
 * Verdict on whether a message continues a recent pending order.
 */
public record ContinuationResult(
        boolean isContinuation,
        double confidence,
        String targetOrderId,
        String targetOrderNumber,
        String reasoning,
        DetectionMethod detectionMethod
) {
    public ContinuationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(detectionMethod, "detectionMethod is required");
        reasoning = reasoning != null ? reasoning : "";
        if (isContinuation && targetOrderId == null) {
            throw new IllegalArgumentException("A continuation must name its target order");
        }
    }

    public static ContinuationResult notContinuation(double confidence, String reasoning, DetectionMethod method) {
        return new ContinuationResult(false, confidence, null, null, reasoning, method);
    }
}

package com.order.consolidation.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A consolidated order ready to be handed to the order gateway.
 * The total is the sum of the line totals; no other pricing is applied.
 */
public record OrderRequest(
        String customerId,
        String distributorId,
        String conversationId,
        List<OrderLine> lines,
        BigDecimal totalAmount,
        List<String> sourceMessageIds,
        String sessionId,
        double confidence,
        boolean requiresReview,
        String comment
) {
    public OrderRequest {
        Objects.requireNonNull(customerId, "customerId is required");
        Objects.requireNonNull(conversationId, "conversationId is required");
        lines = lines != null ? List.copyOf(lines) : List.of();
        totalAmount = totalAmount != null ? totalAmount : BigDecimal.ZERO;
        sourceMessageIds = sourceMessageIds != null ? List.copyOf(sourceMessageIds) : List.of();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String customerId;
        private String distributorId;
        private String conversationId;
        private List<OrderLine> lines;
        private BigDecimal totalAmount;
        private List<String> sourceMessageIds;
        private String sessionId;
        private double confidence;
        private boolean requiresReview;
        private String comment;

        public Builder customerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder distributorId(String distributorId) {
            this.distributorId = distributorId;
            return this;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder lines(List<OrderLine> lines) {
            this.lines = lines;
            return this;
        }

        public Builder totalAmount(BigDecimal totalAmount) {
            this.totalAmount = totalAmount;
            return this;
        }

        public Builder sourceMessageIds(List<String> sourceMessageIds) {
            this.sourceMessageIds = sourceMessageIds;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder requiresReview(boolean requiresReview) {
            this.requiresReview = requiresReview;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public OrderRequest build() {
            return new OrderRequest(customerId, distributorId, conversationId, lines, totalAmount,
                    sourceMessageIds, sessionId, confidence, requiresReview, comment);
        }
    }
}

package com.order.consolidation.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of a multi-message order session.
 * Updates go through {@link #toBuilder()} and the repository's atomic update.
 *
 * <p>{@code collectedMessageIds} keeps arrival order and never holds duplicates.</p>
 */
public record OrderSession(
        String id,
        String conversationId,
        String distributorId,
        SessionStatus status,
        Instant startedAt,
        Instant lastActivityAt,
        Instant expiresAt,
        Instant closedAt,
        List<String> collectedMessageIds,
        int totalMessagesCount,
        ConsolidatedSnapshot consolidatedSnapshot,
        double confidenceScore,
        boolean requiresReview,
        Map<String, String> metadata
) {
    public OrderSession {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(conversationId, "conversationId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        lastActivityAt = lastActivityAt != null ? lastActivityAt : startedAt;
        collectedMessageIds = collectedMessageIds != null
                ? List.copyOf(new LinkedHashSet<>(collectedMessageIds))
                : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (status == SessionStatus.CLOSED && closedAt == null) {
            throw new IllegalArgumentException("A closed session must have closedAt");
        }
    }

    /**
     * Returns true if the session's expiry is at or before {@code now}.
     */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean hasCollected(String messageId) {
        return collectedMessageIds.contains(messageId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .conversationId(conversationId)
                .distributorId(distributorId)
                .status(status)
                .startedAt(startedAt)
                .lastActivityAt(lastActivityAt)
                .expiresAt(expiresAt)
                .closedAt(closedAt)
                .collectedMessageIds(collectedMessageIds)
                .totalMessagesCount(totalMessagesCount)
                .consolidatedSnapshot(consolidatedSnapshot)
                .confidenceScore(confidenceScore)
                .requiresReview(requiresReview)
                .metadata(metadata);
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String conversationId;
        private String distributorId;
        private SessionStatus status = SessionStatus.ACTIVE;
        private Instant startedAt;
        private Instant lastActivityAt;
        private Instant expiresAt;
        private Instant closedAt;
        private List<String> collectedMessageIds = new ArrayList<>();
        private int totalMessagesCount;
        private ConsolidatedSnapshot consolidatedSnapshot;
        private double confidenceScore;
        private boolean requiresReview;
        private Map<String, String> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder distributorId(String distributorId) {
            this.distributorId = distributorId;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder lastActivityAt(Instant lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder collectedMessageIds(List<String> collectedMessageIds) {
            this.collectedMessageIds = new ArrayList<>(collectedMessageIds);
            return this;
        }

        public Builder totalMessagesCount(int totalMessagesCount) {
            this.totalMessagesCount = totalMessagesCount;
            return this;
        }

        public Builder consolidatedSnapshot(ConsolidatedSnapshot consolidatedSnapshot) {
            this.consolidatedSnapshot = consolidatedSnapshot;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder requiresReview(boolean requiresReview) {
            this.requiresReview = requiresReview;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public OrderSession build() {
            return new OrderSession(id, conversationId, distributorId, status, startedAt, lastActivityAt,
                    expiresAt, closedAt, collectedMessageIds, totalMessagesCount, consolidatedSnapshot,
                    confidenceScore, requiresReview, metadata);
        }
    }
}

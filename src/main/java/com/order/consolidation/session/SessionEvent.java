package com.order.consolidation.session;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable entry of a session's append-only event log.
 */
public record SessionEvent(
        String id,
        String sessionId,
        SessionEventType type,
        String messageId,
        SessionStatus previousStatus,
        SessionStatus newStatus,
        Map<String, Object> details,
        Instant timestamp
) {
    public SessionEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sessionId;
        private SessionEventType type;
        private String messageId;
        private SessionStatus previousStatus;
        private SessionStatus newStatus;
        private Map<String, Object> details;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder type(SessionEventType type) {
            this.type = type;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder previousStatus(SessionStatus previousStatus) {
            this.previousStatus = previousStatus;
            return this;
        }

        public Builder newStatus(SessionStatus newStatus) {
            this.newStatus = newStatus;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public SessionEvent build() {
            return new SessionEvent(id, sessionId, type, messageId, previousStatus, newStatus, details, timestamp);
        }
    }
}

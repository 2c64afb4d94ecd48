package com.order.consolidation.api;

import com.order.consolidation.consolidation.ConsolidationAnalysis;
import com.order.consolidation.continuation.ContinuationResult;
import com.order.consolidation.core.model.MatchResult;
import com.order.consolidation.core.model.OrderRequest;
import com.order.consolidation.pattern.MessageAnalysis;
import com.order.consolidation.session.SessionStatus;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one inbound message.
 *
 * @param messageId         the processed message
 * @param action            what happened to the session
 * @param sessionId         the session the message ended up in, or null
 * @param sessionStatus     that session's status after processing, or null
 * @param previousSessionId the session closed by a roll-over, or null
 * @param itemsAdded        number of items added from this message
 * @param orderRequest      the consolidated order when a session closed, or null
 * @param orderCreated      whether the order gateway created an order
 * @param orderId           id of the created order, or null
 * @param analysis          pattern analysis of the message
 * @param continuation      continuation verdict, when one was computed
 * @param consolidation     timing decision, when one was computed
 * @param matchResults      catalog match of each extracted item, in extraction order
 */
public record ProcessingOutcome(
        String messageId,
        SessionAction action,
        String sessionId,
        SessionStatus sessionStatus,
        String previousSessionId,
        int itemsAdded,
        OrderRequest orderRequest,
        boolean orderCreated,
        String orderId,
        MessageAnalysis analysis,
        ContinuationResult continuation,
        ConsolidationAnalysis consolidation,
        List<MatchResult> matchResults
) {
    public ProcessingOutcome {
        Objects.requireNonNull(messageId, "messageId is required");
        Objects.requireNonNull(action, "action is required");
        matchResults = matchResults != null ? List.copyOf(matchResults) : List.of();
    }

    public Optional<OrderRequest> order() {
        return Optional.ofNullable(orderRequest);
    }

    public Optional<ContinuationResult> continuationResult() {
        return Optional.ofNullable(continuation);
    }

    public Optional<ConsolidationAnalysis> consolidationAnalysis() {
        return Optional.ofNullable(consolidation);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String messageId;
        private SessionAction action = SessionAction.NONE;
        private String sessionId;
        private SessionStatus sessionStatus;
        private String previousSessionId;
        private int itemsAdded;
        private OrderRequest orderRequest;
        private boolean orderCreated;
        private String orderId;
        private MessageAnalysis analysis;
        private ContinuationResult continuation;
        private ConsolidationAnalysis consolidation;
        private List<MatchResult> matchResults;

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder action(SessionAction action) {
            this.action = action;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sessionStatus(SessionStatus sessionStatus) {
            this.sessionStatus = sessionStatus;
            return this;
        }

        public Builder previousSessionId(String previousSessionId) {
            this.previousSessionId = previousSessionId;
            return this;
        }

        public Builder itemsAdded(int itemsAdded) {
            this.itemsAdded = itemsAdded;
            return this;
        }

        public Builder orderRequest(OrderRequest orderRequest) {
            this.orderRequest = orderRequest;
            return this;
        }

        public Builder orderCreated(boolean orderCreated) {
            this.orderCreated = orderCreated;
            return this;
        }

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder analysis(MessageAnalysis analysis) {
            this.analysis = analysis;
            return this;
        }

        public Builder continuation(ContinuationResult continuation) {
            this.continuation = continuation;
            return this;
        }

        public Builder consolidation(ConsolidationAnalysis consolidation) {
            this.consolidation = consolidation;
            return this;
        }

        public Builder matchResults(List<MatchResult> matchResults) {
            this.matchResults = matchResults;
            return this;
        }

        public ProcessingOutcome build() {
            return new ProcessingOutcome(messageId, action, sessionId, sessionStatus, previousSessionId,
                    itemsAdded, orderRequest, orderCreated, orderId, analysis, continuation, consolidation,
                    matchResults);
        }
    }
}

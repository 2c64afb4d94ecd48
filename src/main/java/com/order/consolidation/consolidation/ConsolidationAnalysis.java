package com.order.consolidation.consolidation;

import java.util.Objects;

/**
 * Outcome of the timing policy for one message.
 *
 * @param decision           the decision taken
 * @param confidence         confidence in the decision
 * @param reasoning          human-readable explanation
 * @param waitMinutes        suggested wait before deciding again, or null
 * @param timingPattern      timing features, or null when no prior message existed
 *                           or the message was not order-related
 * @param shouldCreateOrder  whether the open order should be created now
 * @param consolidationScore strength of the case for merging with the open order
 * @param orderRelated       whether the message was order-related and the policy applied
 */
public record ConsolidationAnalysis(
        ConsolidationDecision decision,
        double confidence,
        String reasoning,
        Integer waitMinutes,
        TimingPattern timingPattern,
        boolean shouldCreateOrder,
        double consolidationScore,
        boolean orderRelated
) {
    public ConsolidationAnalysis {
        Objects.requireNonNull(decision, "decision is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (consolidationScore < 0.0 || consolidationScore > 1.0) {
            throw new IllegalArgumentException("Consolidation score must be between 0.0 and 1.0");
        }
        reasoning = reasoning != null ? reasoning : "";
    }

    /**
     * True when the message itself says the order is finished.
     */
    public boolean completesOrder() {
        return decision == ConsolidationDecision.ORDER_COMPLETE
                && timingPattern != null
                && timingPattern.hasCompletionSignal();
    }
}

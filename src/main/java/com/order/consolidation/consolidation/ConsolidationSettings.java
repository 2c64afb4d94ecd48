package com.order.consolidation.consolidation;

import java.time.Duration;

/**
 * Effective thresholds and keyword table sizes of a {@link SmartOrderConsolidator}.
 */
public record ConsolidationSettings(
        Duration rapidThreshold,
        Duration normalThreshold,
        Duration slowThreshold,
        Duration frequencyWindow,
        double frequencyBoostThreshold,
        Duration historyLookback,
        int completionKeywordCount,
        int continuationKeywordCount
) {
}

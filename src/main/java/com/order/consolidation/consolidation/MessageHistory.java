package com.order.consolidation.consolidation;

import com.order.consolidation.core.model.OrderMessage;

import java.time.Instant;
import java.util.List;

/**
 * Recent messages of a conversation, used for timing analysis.
 */
public interface MessageHistory {

    /**
     * Returns the conversation's messages created after {@code since}, in any order.
     */
    List<OrderMessage> findRecentMessages(String conversationId, Instant since);

    /**
     * Records a processed message. Read-only histories may ignore it.
     */
    default void record(OrderMessage message) {
    }

    /**
     * Drops messages created before {@code cutoff}. Read-only histories may ignore it.
     *
     * @return the number of messages dropped
     */
    default int prune(Instant cutoff) {
        return 0;
    }
}

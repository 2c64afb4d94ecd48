package com.order.consolidation.consolidation;

/**
 * Pace of a conversation judged by the gap since the previous order-related message.
 */
public enum ConversationPace {
    RAPID,
    NORMAL,
    SLOW,
    PAUSE
}

package com.order.consolidation.consolidation;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Timing and keyword features of a message relative to the conversation's recent order messages.
 *
 * @param timeSinceLastMessage gap since the previous order-related message
 * @param messageFrequency     order-related messages per minute over the trailing frequency window
 * @param pace                 pace bucket of the gap
 * @param continuationSignal   whether a continuation keyword is present
 * @param completionSignals    completion keywords found, in keyword-table order
 */
public record TimingPattern(
        Duration timeSinceLastMessage,
        double messageFrequency,
        ConversationPace pace,
        boolean continuationSignal,
        List<String> completionSignals
) {
    public TimingPattern {
        Objects.requireNonNull(timeSinceLastMessage, "timeSinceLastMessage is required");
        Objects.requireNonNull(pace, "pace is required");
        if (messageFrequency < 0.0) {
            throw new IllegalArgumentException("messageFrequency must be non-negative");
        }
        completionSignals = completionSignals != null ? List.copyOf(completionSignals) : List.of();
    }

    public boolean hasCompletionSignal() {
        return !completionSignals.isEmpty();
    }
}

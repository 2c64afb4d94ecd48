package com.order.consolidation.consolidation;

import com.order.consolidation.core.model.OrderMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link MessageHistory} keyed by conversation.
 *
 * <p>Only the retention window is kept: recording a message drops the conversation's messages
 * older than the retention before it, and {@link #prune(Instant)} drops idle conversations.</p>
 */
public class InMemoryMessageHistory implements MessageHistory {
    private static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final ConcurrentMap<String, List<OrderMessage>> messages = new ConcurrentHashMap<>();
    private final Duration retention;

    public InMemoryMessageHistory() {
        this(DEFAULT_RETENTION);
    }

    public InMemoryMessageHistory(Duration retention) {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
    }

    @Override
    public List<OrderMessage> findRecentMessages(String conversationId, Instant since) {
        List<OrderMessage> conversation = messages.get(conversationId);
        if (conversation == null) {
            return List.of();
        }
        return conversation.stream()
                .filter(message -> message.createdAt().isAfter(since))
                .toList();
    }

    @Override
    public void record(OrderMessage message) {
        Instant cutoff = message.createdAt().minus(retention);
        messages.compute(message.conversationId(), (conversationId, current) -> {
            List<OrderMessage> kept = new ArrayList<>();
            if (current != null) {
                for (OrderMessage existing : current) {
                    if (!existing.createdAt().isBefore(cutoff)) {
                        kept.add(existing);
                    }
                }
            }
            kept.add(message);
            return List.copyOf(kept);
        });
    }

    @Override
    public int prune(Instant cutoff) {
        int[] removed = {0};
        for (String conversationId : List.copyOf(messages.keySet())) {
            messages.computeIfPresent(conversationId, (id, current) -> {
                List<OrderMessage> kept = current.stream()
                        .filter(message -> !message.createdAt().isBefore(cutoff))
                        .toList();
                removed[0] += current.size() - kept.size();
                return kept.isEmpty() ? null : kept;
            });
        }
        return removed[0];
    }

    public int size() {
        return messages.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Number of conversations with at least one retained message.
     */
    public int conversationCount() {
        return messages.size();
    }
}

package com.order.consolidation.consolidation;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.core.model.OrderMessage;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import com.order.consolidation.pattern.ExtractedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Timing-based policy deciding whether an order-related message belongs to the open order,
 * finishes it, or starts a new one.
 *
 * <p>The gap since the previous order-related message sets the pace
 * ({@link ConversationPace}); completion and continuation keywords and the recent message
 * frequency refine the decision.</p>
 */
public class SmartOrderConsolidator {
    private static final Logger log = LoggerFactory.getLogger(SmartOrderConsolidator.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;
    private static final int FIRST_MESSAGE_WAIT_MINUTES = 5;
    private static final int NORMAL_PACE_WAIT_MINUTES = 3;
    private static final double FREQUENCY_BOOST = 0.1;

    static final List<String> COMPLETION_KEYWORDS = List.of(
            "eso es todo", "es todo", "nada más", "ya está", "listo",
            "eso sería todo", "con eso", "suficiente", "gracias",
            "eso me queda bien", "está bien", "perfecto",
            "that's all", "that's it", "done", "complete", "finished",
            "nothing else", "good", "perfect", "thanks"
    );

    static final List<String> CONTINUATION_KEYWORDS = List.of(
            "también", "además", "y", "otra cosa", "ah", "espera",
            "también quiero", "y también", "ah sí",
            "also", "and", "plus", "wait", "oh", "another thing"
    );

    private final List<Pattern> completionPatterns;
    private final List<Pattern> continuationPatterns;
    private final EngineOptions options;
    private final MessageHistory history;
    private final MetricsService metricsService;

    public SmartOrderConsolidator(MessageHistory history) {
        this(EngineOptions.defaults(), history, new NoOpMetricsService());
    }

    public SmartOrderConsolidator(EngineOptions options, MessageHistory history, MetricsService metricsService) {
        this.options = options;
        this.history = history;
        this.metricsService = metricsService;
        this.completionPatterns = compileKeywords(COMPLETION_KEYWORDS);
        this.continuationPatterns = compileKeywords(CONTINUATION_KEYWORDS);
    }

    /**
     * Analyzes one message.
     *
     * @param content        message text
     * @param messageTime    when the message was received; also the reference point for the history window
     * @param conversationId the conversation
     * @param extractedItems items extracted from the message
     * @param orderRelated   whether the message was classified as order-related
     */
    public ConsolidationAnalysis analyze(String content, Instant messageTime, String conversationId,
                                         List<ExtractedItem> extractedItems, boolean orderRelated) {
        ConsolidationAnalysis analysis;
        if (!orderRelated) {
            analysis = new ConsolidationAnalysis(ConsolidationDecision.NEW_ORDER, 0.9,
                    "Non-order message, process separately", null, null, false, 0.0, false);
        } else {
            List<OrderMessage> recent = recentOrderMessages(conversationId, messageTime);
            if (recent.isEmpty()) {
                analysis = new ConsolidationAnalysis(ConsolidationDecision.WAIT_MORE, 0.8,
                        "First order message, wait for potential follow-ups",
                        FIRST_MESSAGE_WAIT_MINUTES, null, false, 0.0, true);
            } else {
                String text = content != null ? content.toLowerCase(Locale.ROOT).trim() : "";
                TimingPattern timing = analyzeTiming(messageTime, recent, text);
                boolean hasProducts = extractedItems != null && !extractedItems.isEmpty();
                analysis = decide(timing, hasProducts, recent.size());
            }
        }
        metricsService.recordConsolidationDecision(analysis.decision());
        return analysis;
    }

    /**
     * Computes the timing features of a message against earlier order-related messages,
     * given oldest first.
     */
    public TimingPattern analyzeTiming(Instant messageTime, List<OrderMessage> recentOldestFirst, String content) {
        OrderMessage last = recentOldestFirst.get(recentOldestFirst.size() - 1);
        Duration gap = Duration.between(last.createdAt(), messageTime);
        if (gap.isNegative()) {
            gap = Duration.ZERO;
        }

        Instant frequencyStart = messageTime.minus(options.getFrequencyWindow());
        long inWindow = recentOldestFirst.stream()
                .filter(message -> message.createdAt().isAfter(frequencyStart))
                .count();
        double frequency = inWindow / (options.getFrequencyWindow().toMillis() / 60_000.0);

        ConversationPace pace;
        if (gap.compareTo(options.getRapidThreshold()) <= 0) {
            pace = ConversationPace.RAPID;
        } else if (gap.compareTo(options.getNormalThreshold()) <= 0) {
            pace = ConversationPace.NORMAL;
        } else if (gap.compareTo(options.getSlowThreshold()) <= 0) {
            pace = ConversationPace.SLOW;
        } else {
            pace = ConversationPace.PAUSE;
        }

        String text = content != null ? content : "";
        boolean continuation = continuationPatterns.stream().anyMatch(p -> p.matcher(text).find());
        List<String> completion = new ArrayList<>();
        for (int i = 0; i < completionPatterns.size(); i++) {
            if (completionPatterns.get(i).matcher(text).find()) {
                completion.add(COMPLETION_KEYWORDS.get(i));
            }
        }
        return new TimingPattern(gap, frequency, pace, continuation, completion);
    }

    /**
     * Returns the configured thresholds and keyword table sizes.
     */
    public ConsolidationSettings describeThresholds() {
        return new ConsolidationSettings(
                options.getRapidThreshold(),
                options.getNormalThreshold(),
                options.getSlowThreshold(),
                options.getFrequencyWindow(),
                options.getFrequencyBoostThreshold(),
                options.getHistoryLookback(),
                COMPLETION_KEYWORDS.size(),
                CONTINUATION_KEYWORDS.size());
    }

    private ConsolidationAnalysis decide(TimingPattern timing, boolean hasProducts, int priorMessages) {
        ConsolidationDecision decision = ConsolidationDecision.NEW_ORDER;
        double confidence = 0.5;
        String reasoning = "Default decision";
        boolean shouldCreateOrder = false;
        double score = 0.0;
        Integer waitMinutes = null;

        if (timing.pace() == ConversationPace.RAPID) {
            decision = ConsolidationDecision.CONSOLIDATE;
            confidence = 0.95;
            reasoning = "Very quick follow-up suggests continuation of same order";
            score = 0.9;
        } else if (timing.hasCompletionSignal()) {
            decision = ConsolidationDecision.ORDER_COMPLETE;
            confidence = 0.9;
            reasoning = "Completion signal detected: '" + timing.completionSignals().get(0) + "'";
            shouldCreateOrder = true;
            score = 0.95;
        } else if (timing.continuationSignal()) {
            decision = ConsolidationDecision.CONSOLIDATE;
            confidence = 0.85;
            reasoning = "Continuation signal suggests adding to existing order";
            score = 0.8;
        } else if (timing.pace() == ConversationPace.NORMAL) {
            if (hasProducts) {
                decision = ConsolidationDecision.CONSOLIDATE;
                confidence = 0.75;
                reasoning = "Normal pace with products, likely continuing order";
                score = 0.7;
            } else {
                decision = ConsolidationDecision.WAIT_MORE;
                confidence = 0.6;
                reasoning = "Normal pace, wait to see if more products mentioned";
                waitMinutes = NORMAL_PACE_WAIT_MINUTES;
            }
        } else if (timing.pace() == ConversationPace.SLOW) {
            if (priorMessages >= 2) {
                decision = ConsolidationDecision.ORDER_COMPLETE;
                confidence = 0.8;
                reasoning = "Slow pace after multiple messages suggests order completion";
                shouldCreateOrder = true;
                score = 0.8;
            } else {
                decision = ConsolidationDecision.CONSOLIDATE;
                confidence = 0.65;
                reasoning = "Slow pace but likely related to previous order";
                score = 0.6;
            }
        } else if (priorMessages > 0) {
            decision = ConsolidationDecision.ORDER_COMPLETE;
            confidence = 0.9;
            reasoning = "Long pause suggests previous order is complete";
            shouldCreateOrder = true;
            score = 0.9;
        } else {
            decision = ConsolidationDecision.NEW_ORDER;
            confidence = 0.8;
            reasoning = "Long pause, treat as new order";
        }

        if (timing.messageFrequency() > options.getFrequencyBoostThreshold()
                && decision != ConsolidationDecision.ORDER_COMPLETE) {
            if (decision == ConsolidationDecision.NEW_ORDER) {
                decision = ConsolidationDecision.CONSOLIDATE;
            }
            confidence = Math.min(confidence + FREQUENCY_BOOST, 1.0);
            score = Math.min(score + FREQUENCY_BOOST, 1.0);
        }

        log.info("consolidation.decided decision={} confidence={} pace={} gapSeconds={}",
                decision, confidence, timing.pace(), timing.timeSinceLastMessage().toSeconds());
        return new ConsolidationAnalysis(decision, confidence, reasoning, waitMinutes, timing,
                shouldCreateOrder, score, true);
    }

    /**
     * Order-related messages within the history lookback before {@code messageTime}, oldest first.
     * History failures are logged and treated as an empty history.
     */
    private List<OrderMessage> recentOrderMessages(String conversationId, Instant messageTime) {
        try {
            Instant since = messageTime.minus(options.getHistoryLookback());
            List<OrderMessage> messages = history.findRecentMessages(conversationId, since);
            if (messages == null) {
                return List.of();
            }
            return messages.stream()
                    .filter(OrderMessage::orderRelated)
                    .filter(message -> message.createdAt().isAfter(since))
                    .filter(message -> !message.createdAt().isAfter(messageTime))
                    .sorted(Comparator.comparing(OrderMessage::createdAt))
                    .toList();
        } catch (RuntimeException e) {
            log.warn("consolidation.historyUnavailable conversationId={}", conversationId, e);
            return List.of();
        }
    }

    private static List<Pattern> compileKeywords(List<String> keywords) {
        return keywords.stream()
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", FLAGS))
                .toList();
    }
}

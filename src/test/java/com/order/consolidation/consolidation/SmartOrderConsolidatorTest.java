package com.order.consolidation.consolidation;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.core.model.OrderMessage;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.pattern.ExtractedItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("SmartOrderConsolidator Tests")
class SmartOrderConsolidatorTest {

    private static final Instant T = Instant.parse("2024-05-01T12:00:00Z");
    private static final String CONV = "conv-1";
    private static final List<ExtractedItem> ITEMS = List.of(
            new ExtractedItem(new BigDecimal("2"), null, "panes", 0.8, "2 panes", 0, 7));

    private InMemoryMessageHistory history;
    private MetricsService metricsService;
    private SmartOrderConsolidator consolidator;

    @BeforeEach
    void setUp() {
        history = new InMemoryMessageHistory();
        metricsService = mock(MetricsService.class);
        consolidator = new SmartOrderConsolidator(EngineOptions.defaults(), history, metricsService);
    }

    private void priorMessage(String id, Duration before) {
        history.record(new OrderMessage(id, CONV, T.minus(before), true));
    }

    @Nested
    @DisplayName("Without timing context")
    class NoContextTests {

        @Test
        @DisplayName("Non-order messages are processed separately")
        void nonOrderMessage() {
            ConsolidationAnalysis analysis = consolidator.analyze("hola", T, CONV, List.of(), false);

            assertEquals(ConsolidationDecision.NEW_ORDER, analysis.decision());
            assertEquals(0.9, analysis.confidence());
            assertFalse(analysis.orderRelated());
            assertNull(analysis.timingPattern());
            verify(metricsService).recordConsolidationDecision(ConsolidationDecision.NEW_ORDER);
        }

        @Test
        @DisplayName("First order message waits five minutes for follow-ups")
        void firstOrderMessage() {
            ConsolidationAnalysis analysis = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.WAIT_MORE, analysis.decision());
            assertEquals(0.8, analysis.confidence());
            assertEquals(5, analysis.waitMinutes());
            assertFalse(analysis.shouldCreateOrder());
        }

        @Test
        @DisplayName("History failures are treated as an empty history")
        void historyFailure() {
            MessageHistory broken = (conversationId, since) -> {
                throw new IllegalStateException("history down");
            };
            SmartOrderConsolidator withBrokenHistory = new SmartOrderConsolidator(broken);

            ConsolidationAnalysis analysis = withBrokenHistory.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.WAIT_MORE, analysis.decision());
        }

        @Test
        @DisplayName("Non-order and later messages do not count as history")
        void historyFiltered() {
            history.record(new OrderMessage("m-chat", CONV, T.minusSeconds(10), false));
            history.record(new OrderMessage("m-later", CONV, T.plusSeconds(10), true));
            history.record(new OrderMessage("m-other", "conv-2", T.minusSeconds(10), true));

            ConsolidationAnalysis analysis = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.WAIT_MORE, analysis.decision());
        }
    }

    @Nested
    @DisplayName("Pace decisions")
    class PaceTests {

        @Test
        @DisplayName("Rapid follow-up consolidates")
        void rapidConsolidates() {
            priorMessage("m-1", Duration.ofSeconds(20));

            ConsolidationAnalysis analysis = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.CONSOLIDATE, analysis.decision());
            assertEquals(0.95, analysis.confidence());
            assertEquals(0.9, analysis.consolidationScore());
            assertEquals(ConversationPace.RAPID, analysis.timingPattern().pace());
        }

        @Test
        @DisplayName("Completion keyword completes the order")
        void completionCompletes() {
            priorMessage("m-1", Duration.ofMinutes(2));

            ConsolidationAnalysis analysis = consolidator.analyze("Eso es todo", T, CONV, List.of(), true);

            assertEquals(ConsolidationDecision.ORDER_COMPLETE, analysis.decision());
            assertTrue(analysis.shouldCreateOrder());
            assertTrue(analysis.completesOrder());
            assertEquals("eso es todo", analysis.timingPattern().completionSignals().get(0));
            assertEquals("Completion signal detected: 'eso es todo'", analysis.reasoning());
        }

        @Test
        @DisplayName("Continuation keyword consolidates at normal pace")
        void continuationConsolidates() {
            priorMessage("m-1", Duration.ofMinutes(2));

            ConsolidationAnalysis analysis = consolidator.analyze("y pan", T, CONV, List.of(), true);

            assertEquals(ConsolidationDecision.CONSOLIDATE, analysis.decision());
            assertEquals(0.85, analysis.confidence());
            assertTrue(analysis.timingPattern().continuationSignal());
        }

        @Test
        @DisplayName("Normal pace consolidates with products and waits without them")
        void normalPace() {
            priorMessage("m-1", Duration.ofMinutes(2));

            ConsolidationAnalysis withProducts = consolidator.analyze("2 panes", T, CONV, ITEMS, true);
            ConsolidationAnalysis without = consolidator.analyze("mmm", T, CONV, List.of(), true);

            assertEquals(ConsolidationDecision.CONSOLIDATE, withProducts.decision());
            assertEquals(0.75, withProducts.confidence());
            assertEquals(ConsolidationDecision.WAIT_MORE, without.decision());
            assertEquals(3, without.waitMinutes());
        }

        @Test
        @DisplayName("Slow pace completes only after several messages")
        void slowPace() {
            priorMessage("m-1", Duration.ofMinutes(5));
            ConsolidationAnalysis single = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            priorMessage("m-0", Duration.ofMinutes(20));
            ConsolidationAnalysis several = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.CONSOLIDATE, single.decision());
            assertEquals(0.65, single.confidence());
            assertEquals(ConsolidationDecision.ORDER_COMPLETE, several.decision());
            assertEquals(0.8, several.confidence());
            assertFalse(several.completesOrder());
        }

        @Test
        @DisplayName("Long pause completes the previous order")
        void pauseCompletes() {
            priorMessage("m-1", Duration.ofMinutes(20));

            ConsolidationAnalysis analysis = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.ORDER_COMPLETE, analysis.decision());
            assertEquals(ConversationPace.PAUSE, analysis.timingPattern().pace());
            assertTrue(analysis.shouldCreateOrder());
        }

        @Test
        @DisplayName("Busy conversations boost confidence")
        void frequencyBoost() {
            for (int minutes = 9; minutes >= 5; minutes--) {
                priorMessage("m-" + minutes, Duration.ofMinutes(minutes));
            }
            priorMessage("m-last", Duration.ofMinutes(2));

            ConsolidationAnalysis analysis = consolidator.analyze("2 panes", T, CONV, ITEMS, true);

            assertEquals(ConsolidationDecision.CONSOLIDATE, analysis.decision());
            assertEquals(0.85, analysis.confidence(), 0.0001);
            assertEquals(0.8, analysis.consolidationScore(), 0.0001);
            assertEquals(0.6, analysis.timingPattern().messageFrequency(), 0.0001);
        }
    }

    @Test
    @DisplayName("Timing is computed from the latest prior message")
    void analyzeTiming() {
        List<OrderMessage> prior = List.of(
                new OrderMessage("a", CONV, T.minus(Duration.ofMinutes(6)), true),
                new OrderMessage("b", CONV, T.minus(Duration.ofSeconds(90)), true));

        TimingPattern timing = consolidator.analyzeTiming(T, prior, "ah, y también galletas");

        assertEquals(Duration.ofSeconds(90), timing.timeSinceLastMessage());
        assertEquals(ConversationPace.NORMAL, timing.pace());
        assertTrue(timing.continuationSignal());
        assertFalse(timing.hasCompletionSignal());
    }

    @Test
    @DisplayName("Settings reflect the options and keyword tables")
    void describeThresholds() {
        ConsolidationSettings settings = consolidator.describeThresholds();

        assertEquals(Duration.ofSeconds(30), settings.rapidThreshold());
        assertEquals(Duration.ofMinutes(8), settings.slowThreshold());
        assertEquals(21, settings.completionKeywordCount());
        assertEquals(15, settings.continuationKeywordCount());
        verify(metricsService, never()).recordConsolidationDecision(any());
    }
}

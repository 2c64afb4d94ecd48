package com.order.consolidation.api;

import com.order.consolidation.catalog.InMemoryCatalogProvider;
import com.order.consolidation.consolidation.ConsolidationDecision;
import com.order.consolidation.consolidation.InMemoryMessageHistory;
import com.order.consolidation.continuation.DetectionMethod;
import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.core.model.ConfidenceLevel;
import com.order.consolidation.core.model.InboundMessage;
import com.order.consolidation.core.model.OrderRequest;
import com.order.consolidation.core.model.OrderSignal;
import com.order.consolidation.metrics.MicrometerMetricsService;
import com.order.consolidation.session.InMemorySessionRepository;
import com.order.consolidation.session.OrderSession;
import com.order.consolidation.session.OrderSessionItem;
import com.order.consolidation.session.SessionEventType;
import com.order.consolidation.session.SessionStatus;
import com.order.consolidation.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderConsolidationEngine Tests")
class OrderConsolidationEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final String CONV = "conv-1";
    private static final String CUSTOMER = "cust-1";
    private static final String DISTRIBUTOR = "dist-1";

    private static final CatalogEntry LECHE = CatalogEntry.builder()
            .id("LECHE").name("Leche").price("25.00").aliases("leches").build();
    private static final CatalogEntry COCA = CatalogEntry.builder()
            .id("COCA").name("Coca Cola 600ml").price("18.50").aliases("cocas", "coca").build();

    @Mock
    private OrderGateway orderGateway;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemorySessionRepository repository;
    private OrderConsolidationEngine engine;
    private int messageCounter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new SimpleMeterRegistry();
        repository = new InMemorySessionRepository();
        InMemoryCatalogProvider catalogs = new InMemoryCatalogProvider();
        catalogs.register(DISTRIBUTOR, List.of(LECHE, COCA));

        engine = OrderConsolidationEngine.builder()
                .clock(clock)
                .metricsService(new MicrometerMetricsService(registry))
                .sessionRepository(repository)
                .catalogProvider(catalogs)
                .orderGateway(orderGateway)
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private ProcessingOutcome send(String content, OrderSignal signal) {
        return send(CUSTOMER, content, signal);
    }

    private ProcessingOutcome send(String customerId, String content, OrderSignal signal) {
        messageCounter++;
        InboundMessage message = new InboundMessage("m-" + messageCounter, CONV, customerId, DISTRIBUTOR,
                content, clock.instant());
        return engine.process(message, signal);
    }

    private static OrderSignal order() {
        return OrderSignal.orderRelated(0.9);
    }

    // ============ Multi-message Order Tests ============

    @Nested
    @DisplayName("Multi-message order")
    class MultiMessageTests {

        @Test
        @DisplayName("Three messages become one order")
        void threeMessagesOneOrder() {
            when(orderGateway.createOrder(any())).thenReturn("order-1");

            ProcessingOutcome first = send("Quiero 2 leches", order());

            assertEquals(SessionAction.STARTED, first.action());
            assertEquals(SessionStatus.COLLECTING, first.sessionStatus());
            assertEquals(1, first.itemsAdded());
            assertEquals(ConfidenceLevel.HIGH, first.matchResults().get(0).confidenceLevel());
            OrderSessionItem leche = engine.getSessionManager().getSessionItems(first.sessionId()).get(0);
            assertEquals("Leche", leche.productName());
            assertEquals(new BigDecimal("50.00"), leche.lineTotal());
            assertEquals("LECHE", leche.suggestedCatalogId());

            clock.advance(Duration.ofSeconds(30));
            ProcessingOutcome second = send("también 3 cocas", order());

            assertEquals(SessionAction.EXTENDED, second.action());
            assertEquals(first.sessionId(), second.sessionId());
            assertTrue(second.continuation().isContinuation());
            assertEquals(0.95, second.continuation().confidence());
            assertEquals(first.sessionId(), second.continuation().targetOrderId());
            assertEquals(ConsolidationDecision.CONSOLIDATE, second.consolidation().decision());
            assertEquals(2, engine.getSessionManager().getSessionItems(first.sessionId()).size());
            OrderSession extended = engine.getSessionManager().getSession(first.sessionId()).orElseThrow();
            assertEquals(T0.plus(Duration.ofMinutes(35)), extended.expiresAt());

            clock.advance(Duration.ofSeconds(30));
            ProcessingOutcome third = send("Eso es todo, gracias", OrderSignal.notOrderRelated());

            assertEquals(SessionAction.CLOSED, third.action());
            assertEquals(SessionStatus.CLOSED, third.sessionStatus());
            assertTrue(third.orderCreated());
            assertEquals("order-1", third.orderId());
            OrderRequest request = third.order().orElseThrow();
            assertEquals(CUSTOMER, request.customerId());
            assertEquals(DISTRIBUTOR, request.distributorId());
            assertEquals(new BigDecimal("105.50"), request.totalAmount());
            assertEquals(List.of("m-1", "m-2", "m-3"), request.sourceMessageIds());
            assertEquals("Consolidated from 2 items across 3 messages", request.comment());
            verify(orderGateway).createOrder(request);

            OrderSession closed = engine.getSessionManager().getSession(first.sessionId()).orElseThrow();
            assertEquals("order-1", closed.metadata().get("orderId"));
            assertTrue(engine.getSessionManager().getEvents(first.sessionId()).stream()
                    .anyMatch(e -> e.type() == SessionEventType.ORDER_CREATED));
            assertEquals(1.0, registry.find("order.session.started").counter().count());
            assertEquals(1.0, registry.find("order.session.closed").tag("orderCreated", "true").counter().count());
        }

        @Test
        @DisplayName("A slow closing message still completes the order")
        void slowClosingMessage() {
            when(orderGateway.createOrder(any())).thenReturn("order-1");
            ProcessingOutcome first = send("Quiero 2 leches", order());
            clock.advance(Duration.ofSeconds(30));
            send("también 3 cocas", order());

            clock.advance(Duration.ofMinutes(6));
            ProcessingOutcome closing = send("eso es todo", OrderSignal.notOrderRelated());

            assertEquals(SessionAction.CLOSED, closing.action());
            assertEquals(first.sessionId(), closing.sessionId());
            assertTrue(closing.orderCreated());
            assertEquals(2, closing.orderRequest().lines().size());
            assertEquals(new BigDecimal("105.50"), closing.orderRequest().totalAmount());
        }

        @Test
        @DisplayName("A sweep during order creation does not break the close")
        void sweepDuringOrderCreation() {
            when(orderGateway.createOrder(any())).thenAnswer(invocation -> {
                clock.advance(Duration.ofMinutes(31));
                engine.getSessionManager().closeExpiredSessions();
                return "order-1";
            });
            ProcessingOutcome first = send("Quiero 2 leches", order());

            clock.advance(Duration.ofSeconds(30));
            ProcessingOutcome closing = assertDoesNotThrow(() -> send("eso es todo", OrderSignal.notOrderRelated()));

            assertEquals(SessionAction.CLOSED, closing.action());
            assertTrue(closing.orderCreated());
            assertEquals("order-1", closing.orderId());
            OrderSession closed = engine.getSessionManager().getSession(first.sessionId()).orElseThrow();
            assertEquals(SessionStatus.CLOSED, closed.status());
            assertEquals(1, engine.getSessionManager().getEvents(first.sessionId()).stream()
                    .filter(e -> e.type() == SessionEventType.SESSION_CLOSED)
                    .count());
        }

        @Test
        @DisplayName("A new order after a long pause rolls the session over")
        void rollsOver() {
            when(orderGateway.createOrder(any())).thenReturn("order-1");
            ProcessingOutcome first = send("Quiero 2 leches", order());

            clock.advance(Duration.ofMinutes(20));
            ProcessingOutcome second = send("Quiero 3 cocas", order());

            assertEquals(SessionAction.ROLLED_OVER, second.action());
            assertEquals(first.sessionId(), second.previousSessionId());
            assertNotEquals(first.sessionId(), second.sessionId());
            assertFalse(second.continuation().isContinuation());
            assertEquals(ConsolidationDecision.ORDER_COMPLETE, second.consolidation().decision());
            assertTrue(second.orderCreated());
            assertEquals(1, second.orderRequest().lines().size());
            assertEquals("Leche", second.orderRequest().lines().get(0).productName());
            assertEquals(SessionStatus.CLOSED,
                    engine.getSessionManager().getSession(first.sessionId()).orElseThrow().status());
            assertEquals(1, engine.getSessionManager().getSessionItems(second.sessionId()).size());
        }

        @Test
        @DisplayName("Corrections are added with a note and flag the session for review")
        void correctionFlagsReview() {
            ProcessingOutcome first = send("Quiero 2 leches", order());

            clock.advance(Duration.ofMinutes(1));
            ProcessingOutcome second = send("cambio, mejor 3 leches", order());

            assertEquals(SessionAction.EXTENDED, second.action());
            assertEquals(DetectionMethod.TEMPORAL_RULES, second.continuation().detectionMethod());
            List<OrderSessionItem> items = engine.getSessionManager().getSessionItems(first.sessionId());
            assertEquals(2, items.size());
            assertEquals("Correction: cambio, mejor 3 leches", items.get(1).notes());
            assertTrue(engine.getSessionManager().getSession(first.sessionId()).orElseThrow().requiresReview());
        }
    }

    // ============ Failure Handling Tests ============

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("Gateway failure still closes the session")
        void gatewayFailure() {
            when(orderGateway.createOrder(any())).thenThrow(new IllegalStateException("orders down"));
            ProcessingOutcome first = send("Quiero 2 leches", order());

            clock.advance(Duration.ofSeconds(20));
            ProcessingOutcome closing = send("eso es todo", order());

            assertEquals(SessionAction.CLOSED, closing.action());
            assertFalse(closing.orderCreated());
            assertNull(closing.orderId());
            assertTrue(closing.order().isPresent());
            assertEquals(SessionStatus.CLOSED,
                    engine.getSessionManager().getSession(first.sessionId()).orElseThrow().status());
            assertEquals(1.0, registry.find("order.session.closed").tag("orderCreated", "false").counter().count());
        }

        @Test
        @DisplayName("Unknown customer closes without an order")
        void unknownCustomer() {
            send(null, "Quiero 2 leches", order());

            clock.advance(Duration.ofSeconds(20));
            ProcessingOutcome closing = send(null, "eso es todo", order());

            assertEquals(SessionAction.CLOSED, closing.action());
            assertTrue(closing.order().isEmpty());
            assertFalse(closing.orderCreated());
            verifyNoInteractions(orderGateway);
        }

        @Test
        @DisplayName("Catalog failures fall back to unmatched items")
        void catalogFailure() {
            OrderConsolidationEngine failing = OrderConsolidationEngine.builder()
                    .clock(clock)
                    .catalogProvider(distributorId -> {
                        throw new IllegalStateException("catalog down");
                    })
                    .build();

            ProcessingOutcome outcome = failing.process(
                    new InboundMessage("x-1", "conv-x", CUSTOMER, DISTRIBUTOR, "Quiero 2 leches", clock.instant()),
                    order());

            assertEquals(SessionAction.STARTED, outcome.action());
            assertEquals(ConfidenceLevel.NONE, outcome.matchResults().get(0).confidenceLevel());
            assertTrue(failing.getSessionManager().getSession(outcome.sessionId()).orElseThrow().requiresReview());
        }
    }

    // ============ Non-order Message Tests ============

    @Test
    @DisplayName("Small talk starts nothing")
    void smallTalk() {
        ProcessingOutcome outcome = send("hola, buenos días", OrderSignal.notOrderRelated());

        assertEquals(SessionAction.NONE, outcome.action());
        assertNull(outcome.sessionId());
        assertEquals(0, repository.size());
    }

    @Test
    @DisplayName("Small talk during a session leaves it untouched")
    void smallTalkDuringSession() {
        ProcessingOutcome first = send("Quiero 2 leches", order());
        OrderSession before = engine.getSessionManager().getSession(first.sessionId()).orElseThrow();

        clock.advance(Duration.ofSeconds(40));
        ProcessingOutcome chat = send("hola, buenos días", null);

        assertEquals(SessionAction.NONE, chat.action());
        assertEquals(first.sessionId(), chat.sessionId());
        assertEquals(before.expiresAt(),
                engine.getSessionManager().getSession(first.sessionId()).orElseThrow().expiresAt());
    }

    @Test
    @DisplayName("Expired sessions are closed without an order on the next message")
    void expiredSession() {
        ProcessingOutcome first = send("Quiero 2 leches", order());

        clock.advance(Duration.ofMinutes(31));
        ProcessingOutcome later = send("hola", OrderSignal.notOrderRelated());

        assertEquals(SessionAction.NONE, later.action());
        OrderSession expired = engine.getSessionManager().getSession(first.sessionId()).orElseThrow();
        assertEquals(SessionStatus.CLOSED, expired.status());
        assertEquals(1.0, registry.find("order.session.expired").counter().count());
        verifyNoInteractions(orderGateway);
    }

    @Test
    @DisplayName("Concurrent messages of one conversation share a single open session")
    void concurrentMessages() throws InterruptedException {
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < threads; i++) {
            String id = "c-" + i;
            executor.submit(() -> {
                start.await();
                engine.process(new InboundMessage(id, CONV, CUSTOMER, DISTRIBUTOR, "Quiero 2 leches", T0),
                        order());
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        long open = repository.findByConversation(CONV).stream()
                .filter(s -> s.status().isOpen())
                .count();
        assertEquals(1, open);
        OrderSession session = engine.getSessionManager().getActiveSession(CONV).orElseThrow();
        assertEquals(threads, session.totalMessagesCount());
    }

    @Test
    @DisplayName("History of idle conversations is dropped after the lookback")
    void idleHistoryPruned() {
        InMemoryMessageHistory history = new InMemoryMessageHistory();
        try (OrderConsolidationEngine withHistory = OrderConsolidationEngine.builder()
                .clock(clock)
                .messageHistory(history)
                .build()) {
            withHistory.process(new InboundMessage("h-1", "conv-idle", CUSTOMER, DISTRIBUTOR, "hola",
                    clock.instant()), OrderSignal.notOrderRelated());
            assertEquals(1, history.conversationCount());

            clock.advance(Duration.ofHours(2));
            withHistory.process(new InboundMessage("h-2", "conv-busy", CUSTOMER, DISTRIBUTOR, "hola",
                    clock.instant()), OrderSignal.notOrderRelated());

            assertEquals(1, history.conversationCount());
            assertTrue(history.findRecentMessages("conv-idle", Instant.EPOCH).isEmpty());
        }
    }
}

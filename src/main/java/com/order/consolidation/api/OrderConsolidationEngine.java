package com.order.consolidation.api;

import com.order.consolidation.cache.CacheConfig;
import com.order.consolidation.cache.NormalizedCatalogCache;
import com.order.consolidation.catalog.CatalogProvider;
import com.order.consolidation.consolidation.ConsolidationAnalysis;
import com.order.consolidation.consolidation.ConsolidationDecision;
import com.order.consolidation.consolidation.InMemoryMessageHistory;
import com.order.consolidation.consolidation.MessageHistory;
import com.order.consolidation.consolidation.SmartOrderConsolidator;
import com.order.consolidation.continuation.ContinuationDetector;
import com.order.consolidation.continuation.ContinuationResult;
import com.order.consolidation.continuation.DetectionMethod;
import com.order.consolidation.continuation.RecentOrdersLookup;
import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.core.model.ConfidenceLevel;
import com.order.consolidation.core.model.InboundMessage;
import com.order.consolidation.core.model.MatchResult;
import com.order.consolidation.core.model.OrderMessage;
import com.order.consolidation.core.model.OrderRequest;
import com.order.consolidation.core.model.OrderSignal;
import com.order.consolidation.core.model.OrderStatus;
import com.order.consolidation.core.model.RecentOrder;
import com.order.consolidation.lock.ConversationLock;
import com.order.consolidation.lock.LocalConversationLock;
import com.order.consolidation.logging.LogContext;
import com.order.consolidation.matching.ProductMatcher;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import com.order.consolidation.pattern.ExtractedItem;
import com.order.consolidation.pattern.MessageAnalysis;
import com.order.consolidation.pattern.PatternDetector;
import com.order.consolidation.pattern.SuggestedAction;
import com.order.consolidation.rules.TextNormalizer;
import com.order.consolidation.session.ConversationDirectory;
import com.order.consolidation.session.InMemoryConversationDirectory;
import com.order.consolidation.session.IllegalSessionTransitionException;
import com.order.consolidation.session.InMemorySessionRepository;
import com.order.consolidation.session.ItemDraft;
import com.order.consolidation.session.OrderSession;
import com.order.consolidation.session.OrderSessionItem;
import com.order.consolidation.session.OrderSessionManager;
import com.order.consolidation.session.SessionExpirySweeper;
import com.order.consolidation.session.SessionRepository;
import com.order.consolidation.session.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point: turns a stream of customer messages into order sessions and, once a
 * session closes, into a consolidated order handed to the {@link OrderGateway}.
 *
 * <p>Each message is processed under its conversation's lock. The order of work is
 * sweep expired sessions, analyze the text, match the extracted items against the
 * distributor's catalog, then start, extend, close or roll over the conversation's session.</p>
 *
 * <pre>
 * OrderConsolidationEngine engine = OrderConsolidationEngine.builder()
 *     .catalogProvider(catalogs)
 *     .orderGateway(orders::create)
 *     .build();
 *
 * ProcessingOutcome outcome = engine.process(message, OrderSignal.orderRelated(0.9));
 * </pre>
 */
public class OrderConsolidationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OrderConsolidationEngine.class);

    private static final int MONEY_SCALE = 2;

    private final EngineOptions options;
    private final Clock clock;
    private final MetricsService metricsService;
    private final PatternDetector patternDetector;
    private final ProductMatcher productMatcher;
    private final ContinuationDetector continuationDetector;
    private final SmartOrderConsolidator consolidator;
    private final OrderSessionManager sessionManager;
    private final ConversationDirectory conversationDirectory;
    private final CatalogProvider catalogProvider;
    private final RecentOrdersLookup recentOrdersLookup;
    private final MessageHistory messageHistory;
    private final OrderGateway orderGateway;
    private final ConversationLock conversationLock;
    private final SessionExpirySweeper sweeper;
    private final AtomicReference<Instant> lastHistoryPrune;

    private OrderConsolidationEngine(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.lastHistoryPrune = new AtomicReference<>(builder.clock.instant());
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.conversationDirectory = builder.conversationDirectory != null
                ? builder.conversationDirectory : new InMemoryConversationDirectory();
        this.catalogProvider = builder.catalogProvider != null
                ? builder.catalogProvider : distributorId -> List.of();
        this.recentOrdersLookup = builder.recentOrdersLookup != null
                ? builder.recentOrdersLookup : (customerId, lookback) -> List.of();
        this.messageHistory = builder.messageHistory != null
                ? builder.messageHistory : new InMemoryMessageHistory(builder.options.getHistoryLookback());
        this.orderGateway = builder.orderGateway != null
                ? builder.orderGateway : request -> null;
        this.conversationLock = builder.conversationLock != null
                ? builder.conversationLock : new LocalConversationLock();

        TextNormalizer normalizer = new TextNormalizer();
        NormalizedCatalogCache catalogCache = new NormalizedCatalogCache(normalizer, builder.cacheConfig,
                metricsService);
        this.patternDetector = new PatternDetector();
        this.productMatcher = new ProductMatcher(options, normalizer, catalogCache, metricsService);
        this.continuationDetector = new ContinuationDetector(options, clock, metricsService);
        this.consolidator = new SmartOrderConsolidator(options, messageHistory, metricsService);

        SessionRepository repository = builder.sessionRepository != null
                ? builder.sessionRepository : new InMemorySessionRepository();
        this.sessionManager = new OrderSessionManager(repository, conversationDirectory, options, clock,
                metricsService);

        if (builder.startSweeper) {
            this.sweeper = new SessionExpirySweeper(sessionManager, options.getSweepInterval());
            sweeper.start();
        } else {
            this.sweeper = null;
        }
        log.info("engine.initialized sweeper={}", builder.startSweeper);
    }

    /**
     * Processes one inbound message.
     *
     * @param message the customer message
     * @param signal  the external order-relatedness verdict; null means not order-related
     * @throws com.order.consolidation.lock.LockAcquisitionException if the conversation stays locked
     */
    public ProcessingOutcome process(InboundMessage message, OrderSignal signal) {
        Objects.requireNonNull(message, "message is required");
        OrderSignal effectiveSignal = signal != null ? signal : OrderSignal.notOrderRelated();
        long startNanos = System.nanoTime();

        ProcessingOutcome outcome;
        conversationLock.lock(message.conversationId());
        try (LogContext ctx = LogContext.forMessage(message.id(), message.conversationId())) {
            outcome = processLocked(message, effectiveSignal);
        } finally {
            conversationLock.unlock(message.conversationId());
        }

        metricsService.recordProcessingDuration(outcome.action(), Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("message.processed action={} sessionId={} status={} itemsAdded={}",
                outcome.action(), outcome.sessionId(), outcome.sessionStatus(), outcome.itemsAdded());
        return outcome;
    }

    private ProcessingOutcome processLocked(InboundMessage message, OrderSignal signal) {
        conversationDirectory.register(message.conversationId(), message.customerId());
        sessionManager.closeExpiredSessions();
        pruneHistory();

        MessageAnalysis analysis = patternDetector.analyzeMessageContext(message.content());
        boolean orderRelated = signal.orderRelated() || analysis.hasOrderIntent() || analysis.hasItems();
        ResolvedItems resolved = resolveItems(message, analysis);

        ProcessingOutcome.Builder outcome = ProcessingOutcome.builder()
                .messageId(message.id())
                .analysis(analysis)
                .matchResults(resolved.matches());

        Optional<OrderSession> active = sessionManager.getActiveSession(message.conversationId());
        if (active.isEmpty()) {
            if (canStartSession(signal, analysis)) {
                startSession(message, resolved, outcome);
            }
        } else if (analysis.suggestedAction() == SuggestedAction.CLOSE_SESSION
                && analysis.closingConfidence() >= options.getSessionCloseThreshold()) {
            OrderSession session = active.get();
            sessionManager.addMessageToSession(session.id(), message.id(), false);
            int added = addItems(session.id(), resolved);
            outcome.itemsAdded(added);
            closeSession(session.id(), "closing_phrase", outcome);
        } else if (signal.orderRelated() || analysis.suggestedAction() != SuggestedAction.NONE) {
            extendSession(active.get(), message, analysis, resolved, orderRelated, outcome);
        } else {
            outcome.sessionId(active.get().id()).sessionStatus(active.get().status());
        }

        messageHistory.record(new OrderMessage(message.id(), message.conversationId(), message.receivedAt(),
                orderRelated));
        return outcome.build();
    }

    /**
     * Drops history older than the lookback, at most once per sweep interval.
     */
    private void pruneHistory() {
        Instant now = clock.instant();
        Instant last = lastHistoryPrune.get();
        if (now.isBefore(last.plus(options.getSweepInterval())) || !lastHistoryPrune.compareAndSet(last, now)) {
            return;
        }
        int removed = messageHistory.prune(now.minus(options.getHistoryLookback()));
        if (removed > 0) {
            log.debug("history.pruned removed={}", removed);
        }
    }

    private boolean canStartSession(OrderSignal signal, MessageAnalysis analysis) {
        boolean wantsSession = signal.orderRelated()
                || analysis.suggestedAction() == SuggestedAction.START_OR_EXTEND_SESSION;
        return wantsSession && analysis.overallConfidence() >= options.getSessionStartThreshold();
    }

    private void startSession(InboundMessage message, ResolvedItems resolved, ProcessingOutcome.Builder outcome) {
        Map<String, String> metadata = new HashMap<>();
        if (message.customerId() != null) {
            metadata.put("customerId", message.customerId());
        }
        OrderSession session = sessionManager.createSession(message.conversationId(), message.distributorId(),
                message.id(), metadata);

        int added = addItems(session.id(), resolved);
        if (added > 0) {
            sessionManager.transitionStatus(session.id(), SessionStatus.COLLECTING, Map.of("reason", "items_added"));
        }
        outcome.action(SessionAction.STARTED)
                .sessionId(session.id())
                .sessionStatus(currentStatus(session.id()))
                .itemsAdded(added);
    }

    private void extendSession(OrderSession session, InboundMessage message, MessageAnalysis analysis,
                               ResolvedItems resolved, boolean orderRelated, ProcessingOutcome.Builder outcome) {
        String customerId = message.customerId() != null
                ? message.customerId()
                : conversationDirectory.findCustomerId(message.conversationId()).orElse(null);
        ContinuationResult continuation = continuationDetector.checkContinuation(message.content(),
                message.conversationId(), customerId, withOpenSession(session), message.receivedAt());
        ConsolidationAnalysis consolidation = consolidator.analyze(message.content(), message.receivedAt(),
                message.conversationId(), analysis.extractedItems(), orderRelated);
        outcome.continuation(continuation).consolidation(consolidation);

        if (startsNewOrder(continuation, consolidation, analysis)) {
            log.info("session.rollingOver sessionId={} decision={}", session.id(), consolidation.decision());
            closeSession(session.id(), "new_order", outcome);
            outcome.previousSessionId(session.id());
            startSession(message, resolved, outcome);
            outcome.action(SessionAction.ROLLED_OVER);
            return;
        }

        sessionManager.addMessageToSession(session.id(), message.id(), true);
        int added = addItems(session.id(), resolved);
        if (added > 0 && currentStatus(session.id()) == SessionStatus.ACTIVE) {
            sessionManager.transitionStatus(session.id(), SessionStatus.COLLECTING, Map.of("reason", "items_added"));
        }
        if (analysis.suggestedAction() == SuggestedAction.MODIFY_SESSION) {
            sessionManager.markRequiresReview(session.id());
        }
        outcome.itemsAdded(added);

        if (consolidation.completesOrder()) {
            closeSession(session.id(), "order_complete", outcome);
        } else {
            outcome.action(SessionAction.EXTENDED)
                    .sessionId(session.id())
                    .sessionStatus(currentStatus(session.id()));
        }
    }

    /**
     * A message that is clearly not a continuation and carries its own items opens a new order
     * when the timing policy says the open one is done or unrelated.
     */
    private boolean startsNewOrder(ContinuationResult continuation, ConsolidationAnalysis consolidation,
                                   MessageAnalysis analysis) {
        if (continuation.isContinuation() || continuation.detectionMethod() == DetectionMethod.ERROR) {
            return false;
        }
        if (!consolidation.orderRelated() || !analysis.hasItems()) {
            return false;
        }
        return consolidation.decision() == ConsolidationDecision.NEW_ORDER
                || (consolidation.decision() == ConsolidationDecision.ORDER_COMPLETE
                && !consolidation.completesOrder());
    }

    /**
     * Moves the session through REVIEWING to CLOSED, consolidating it and handing the order
     * to the gateway on the way. Consolidation or gateway failures still close the session.
     */
    private void closeSession(String sessionId, String reason, ProcessingOutcome.Builder outcome) {
        try {
            if (currentStatus(sessionId) == SessionStatus.ACTIVE) {
                sessionManager.transitionStatus(sessionId, SessionStatus.COLLECTING, Map.of("reason", reason));
            }
            sessionManager.transitionStatus(sessionId, SessionStatus.REVIEWING, Map.of("reason", reason));
        } catch (IllegalSessionTransitionException e) {
            // expired and swept after the active-session lookup
            log.warn("session.closeSkipped sessionId={} status={}", sessionId, e.getFrom());
            outcome.sessionId(sessionId).sessionStatus(e.getFrom());
            return;
        }

        OrderRequest request = null;
        String orderId = null;
        try {
            request = sessionManager.consolidateSession(sessionId).orElse(null);
            if (request != null) {
                orderId = orderGateway.createOrder(request);
                if (orderId != null) {
                    sessionManager.recordOrderCreated(sessionId, orderId);
                }
            }
        } catch (RuntimeException e) {
            log.error("session.orderCreationFailed sessionId={} error={}", sessionId, e.getMessage(), e);
        }

        boolean orderCreated = orderId != null;
        Map<String, Object> eventData = new HashMap<>();
        eventData.put("reason", reason);
        eventData.put("orderCreated", orderCreated);
        if (!sessionManager.transitionStatus(sessionId, SessionStatus.CLOSED, eventData)) {
            log.warn("session.closedConcurrently sessionId={} orderId={}", sessionId, orderId);
        }

        outcome.action(SessionAction.CLOSED)
                .sessionId(sessionId)
                .sessionStatus(SessionStatus.CLOSED)
                .orderRequest(request)
                .orderCreated(orderCreated)
                .orderId(orderId);
    }

    private int addItems(String sessionId, ResolvedItems resolved) {
        int added = 0;
        for (ItemDraft draft : resolved.drafts()) {
            if (sessionManager.addSessionItem(sessionId, draft).isPresent()) {
                added++;
            }
        }
        if (added > 0 && resolved.requiresReview()) {
            sessionManager.markRequiresReview(sessionId);
        }
        return added;
    }

    /**
     * Matches every extracted item against the distributor's catalog. HIGH and MEDIUM matches
     * enrich the item with catalog id, price and line total; anything short of HIGH asks for review.
     */
    private ResolvedItems resolveItems(InboundMessage message, MessageAnalysis analysis) {
        if (!analysis.hasItems()) {
            return new ResolvedItems(List.of(), List.of(), false);
        }
        List<CatalogEntry> catalog = catalogFor(message.distributorId());
        String note = analysis.suggestedAction() == SuggestedAction.MODIFY_SESSION
                ? "Correction: " + message.content()
                : null;

        List<ItemDraft> drafts = new ArrayList<>();
        List<MatchResult> matches = new ArrayList<>();
        boolean requiresReview = false;
        for (ExtractedItem item : analysis.extractedItems()) {
            MatchResult match = productMatcher.matchProducts(item.productName(), catalog);
            matches.add(match);
            ConfidenceLevel level = match.confidenceLevel();
            if (level != ConfidenceLevel.HIGH) {
                requiresReview = true;
            }
            if (match.hasMatch() && (level == ConfidenceLevel.HIGH || level == ConfidenceLevel.MEDIUM)) {
                CatalogEntry entry = match.bestMatch().entry();
                BigDecimal lineTotal = entry.price() != null
                        ? item.quantity().multiply(entry.price()).setScale(MONEY_SCALE, RoundingMode.HALF_UP)
                        : null;
                String name = level == ConfidenceLevel.HIGH ? entry.name() : item.productName();
                drafts.add(new ItemDraft(name, item.quantity(), item.unit(), entry.price(), lineTotal,
                        item.confidence(), message.id(), item.originalText(), entry.id(),
                        Math.min(match.bestConfidence(), 1.0), note));
            } else {
                drafts.add(new ItemDraft(item.productName(), item.quantity(), item.unit(), null, null,
                        item.confidence(), message.id(), item.originalText(), null, 0.0, note));
            }
        }
        return new ResolvedItems(drafts, matches, requiresReview);
    }

    private List<CatalogEntry> catalogFor(String distributorId) {
        try {
            List<CatalogEntry> catalog = catalogProvider.catalogFor(distributorId);
            return catalog != null ? catalog : List.of();
        } catch (RuntimeException e) {
            log.warn("catalog.unavailable distributorId={} error={}", distributorId, e.getMessage());
            return List.of();
        }
    }

    /**
     * The external lookup plus the open session itself, as a PENDING order started when the session started.
     */
    private RecentOrdersLookup withOpenSession(OrderSession session) {
        return (customerId, lookback) -> {
            List<RecentOrder> orders = new ArrayList<>();
            if (customerId != null) {
                orders.addAll(recentOrdersLookup.findRecentOrders(customerId, lookback));
            }
            List<String> productNames = sessionManager.getSessionItems(session.id()).stream()
                    .map(OrderSessionItem::productName)
                    .toList();
            orders.add(new RecentOrder(session.id(), null, OrderStatus.PENDING, session.startedAt(), productNames));
            return orders;
        };
    }

    private SessionStatus currentStatus(String sessionId) {
        return sessionManager.getSession(sessionId).map(OrderSession::status).orElse(null);
    }

    // ========== Component Access ==========

    public OrderSessionManager getSessionManager() {
        return sessionManager;
    }

    public ProductMatcher getProductMatcher() {
        return productMatcher;
    }

    public PatternDetector getPatternDetector() {
        return patternDetector;
    }

    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    private record ResolvedItems(List<ItemDraft> drafts, List<MatchResult> matches, boolean requiresReview) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EngineOptions options = EngineOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private MetricsService metricsService;
        private SessionRepository sessionRepository;
        private ConversationDirectory conversationDirectory;
        private CatalogProvider catalogProvider;
        private RecentOrdersLookup recentOrdersLookup;
        private MessageHistory messageHistory;
        private OrderGateway orderGateway;
        private ConversationLock conversationLock;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private boolean startSweeper = false;

        /**
         * Sets engine options.
         */
        public Builder options(EngineOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets the clock used for session timestamps and expiry.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the session store. Defaults to an {@link InMemorySessionRepository}.
         */
        public Builder sessionRepository(SessionRepository sessionRepository) {
            this.sessionRepository = sessionRepository;
            return this;
        }

        /**
         * Sets the conversation to customer directory. Defaults to one filled from inbound messages.
         */
        public Builder conversationDirectory(ConversationDirectory conversationDirectory) {
            this.conversationDirectory = conversationDirectory;
            return this;
        }

        public Builder catalogProvider(CatalogProvider catalogProvider) {
            this.catalogProvider = catalogProvider;
            return this;
        }

        public Builder recentOrdersLookup(RecentOrdersLookup recentOrdersLookup) {
            this.recentOrdersLookup = recentOrdersLookup;
            return this;
        }

        /**
         * Sets the message history used for timing analysis. Defaults to an in-memory history
         * fed by the engine itself.
         */
        public Builder messageHistory(MessageHistory messageHistory) {
            this.messageHistory = messageHistory;
            return this;
        }

        public Builder orderGateway(OrderGateway orderGateway) {
            this.orderGateway = orderGateway;
            return this;
        }

        /**
         * Sets a custom conversation lock. Defaults to a {@link LocalConversationLock}.
         */
        public Builder conversationLock(ConversationLock conversationLock) {
            this.conversationLock = conversationLock;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        /**
         * Starts a background sweeper closing expired sessions every
         * {@link EngineOptions#getSweepInterval()}.
         */
        public Builder startSweeper(boolean startSweeper) {
            this.startSweeper = startSweeper;
            return this;
        }

        public OrderConsolidationEngine build() {
            return new OrderConsolidationEngine(this);
        }
    }
}

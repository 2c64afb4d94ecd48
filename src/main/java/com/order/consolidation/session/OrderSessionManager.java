package com.order.consolidation.session;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.core.model.OrderLine;
import com.order.consolidation.core.model.OrderRequest;
import com.order.consolidation.logging.LogContext;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages the lifecycle of multi-message order sessions: creation, message and item
 * collection, status transitions, consolidation into an {@link OrderRequest} and expiry.
 *
 * <p>Every state change is written to the session's event log.</p>
 */
public class OrderSessionManager {
    private static final Logger log = LoggerFactory.getLogger(OrderSessionManager.class);

    private final SessionRepository repository;
    private final ConversationDirectory directory;
    private final EngineOptions options;
    private final Clock clock;
    private final MetricsService metricsService;

    public OrderSessionManager(SessionRepository repository, ConversationDirectory directory) {
        this(repository, directory, EngineOptions.defaults(), Clock.systemUTC(), new NoOpMetricsService());
    }

    public OrderSessionManager(SessionRepository repository, ConversationDirectory directory,
                               EngineOptions options, Clock clock, MetricsService metricsService) {
        this.repository = repository;
        this.directory = directory;
        this.options = options;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Starts an ACTIVE session holding the initial message.
     *
     * @throws DuplicateSessionException if the conversation already has an open session
     */
    public OrderSession createSession(String conversationId, String distributorId, String initialMessageId,
                                      Map<String, String> metadata) {
        Instant now = clock.instant();
        List<String> messageIds = new ArrayList<>();
        if (initialMessageId != null) {
            messageIds.add(initialMessageId);
        }
        OrderSession session = OrderSession.builder()
                .conversationId(conversationId)
                .distributorId(distributorId)
                .status(SessionStatus.ACTIVE)
                .startedAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plus(options.getSessionTimeout()))
                .collectedMessageIds(messageIds)
                .totalMessagesCount(messageIds.size())
                .metadata(metadata)
                .build();

        OrderSession stored = repository.insertIfNoOpenSession(session);
        logEvent(stored.id(), SessionEventType.SESSION_STARTED, initialMessageId, null, SessionStatus.ACTIVE,
                Map.of("expiresAt", stored.expiresAt().toString()));
        metricsService.incrementSessionStarted();
        try (LogContext ctx = LogContext.forSession(stored.id())) {
            log.info("session.started conversationId={} expiresAt={}", conversationId, stored.expiresAt());
        }
        return stored;
    }

    /**
     * Returns the most recently started ACTIVE or COLLECTING session of the conversation
     * that has not expired yet.
     */
    public Optional<OrderSession> getActiveSession(String conversationId) {
        Instant now = clock.instant();
        return repository.findByConversation(conversationId).stream()
                .filter(s -> s.status().isCollecting())
                .filter(s -> !s.isExpiredAt(now))
                .max(Comparator.comparing(OrderSession::startedAt));
    }

    public Optional<OrderSession> getSession(String sessionId) {
        return repository.findById(sessionId);
    }

    /**
     * Returns the session's ACTIVE items in sequence order.
     */
    public List<OrderSessionItem> getSessionItems(String sessionId) {
        return repository.findItems(sessionId).stream()
                .filter(OrderSessionItem::isActive)
                .toList();
    }

    public List<SessionEvent> getEvents(String sessionId) {
        return repository.findEvents(sessionId);
    }

    /**
     * Adds a message to an open session. Adding an already collected message changes nothing
     * but the activity time.
     *
     * @param extend whether to push the expiry back by the extension timeout; the new expiry is
     *               counted from the later of the current expiry and now, so it always grows
     * @return false if the session does not exist or is closed
     */
    public boolean addMessageToSession(String sessionId, String messageId, boolean extend) {
        Instant now = clock.instant();
        boolean[] added = {false};
        Optional<OrderSession> updated = repository.update(sessionId, current -> {
            if (!current.status().isOpen()) {
                return current;
            }
            List<String> ids = new ArrayList<>(current.collectedMessageIds());
            if (!ids.contains(messageId)) {
                ids.add(messageId);
                added[0] = true;
            }
            OrderSession.Builder builder = current.toBuilder()
                    .collectedMessageIds(ids)
                    .totalMessagesCount(ids.size())
                    .lastActivityAt(now);
            if (extend) {
                builder.expiresAt(extendedExpiry(current.expiresAt(), now));
            }
            return builder.build();
        });

        if (updated.isEmpty() || !updated.get().status().isOpen()) {
            log.warn("session.messageRejected sessionId={} messageId={}", sessionId, messageId);
            return false;
        }
        OrderSession session = updated.get();
        if (added[0]) {
            logEvent(sessionId, SessionEventType.MESSAGE_ADDED, messageId, null, null,
                    Map.of("totalMessages", session.totalMessagesCount()));
        }
        if (extend) {
            logEvent(sessionId, SessionEventType.SESSION_EXTENDED, messageId, null, null,
                    Map.of("expiresAt", session.expiresAt().toString()));
        }
        log.debug("session.messageAdded sessionId={} messageId={} total={}",
                sessionId, messageId, session.totalMessagesCount());
        return true;
    }

    /**
     * Appends an ACTIVE item to a collecting session. The item's source message must already
     * be collected by the session.
     *
     * @return the new item id, or empty if the session is missing, not collecting,
     *         or does not hold the source message
     */
    public Optional<String> addSessionItem(String sessionId, ItemDraft draft) {
        Instant now = clock.instant();
        String[] rejection = {"notCollecting"};
        Optional<OrderSessionItem> appended = repository.appendItem(sessionId,
                current -> {
                    if (!current.status().isCollecting()) {
                        return false;
                    }
                    rejection[0] = "unknownMessage";
                    return current.hasCollected(draft.sourceMessageId());
                },
                sequence -> OrderSessionItem.fromDraft(sessionId, sequence, draft, now));
        if (appended.isEmpty()) {
            log.warn("session.itemRejected sessionId={} reason={} messageId={}",
                    sessionId, rejection[0], draft.sourceMessageId());
            return Optional.empty();
        }
        OrderSessionItem item = appended.get();
        refreshConfidence(sessionId);

        Map<String, Object> details = new HashMap<>();
        details.put("itemId", item.id());
        details.put("productName", item.productName());
        details.put("quantity", item.quantity().toPlainString());
        logEvent(sessionId, SessionEventType.ITEM_EXTRACTED, draft.sourceMessageId(), null, null, details);
        log.info("session.itemAdded sessionId={} itemId={} product='{}' quantity={}",
                sessionId, item.id(), item.productName(), item.quantity());
        return Optional.of(item.id());
    }

    /**
     * Marks an ACTIVE item of an open session as CANCELLED.
     *
     * @return false if the session is closed or the item is missing or already cancelled
     */
    public boolean cancelSessionItem(String sessionId, String itemId, String reason) {
        Optional<OrderSession> session = repository.findById(sessionId);
        if (session.isEmpty() || !session.get().status().isOpen()) {
            return false;
        }
        boolean[] cancelled = {false};
        repository.updateItem(sessionId, itemId, item -> {
            if (!item.isActive()) {
                return item;
            }
            cancelled[0] = true;
            return item.cancelled(reason);
        });
        if (!cancelled[0]) {
            return false;
        }
        refreshConfidence(sessionId);
        Map<String, Object> details = new HashMap<>();
        details.put("itemId", itemId);
        if (reason != null) {
            details.put("reason", reason);
        }
        logEvent(sessionId, SessionEventType.ITEM_CANCELLED, null, null, null, details);
        log.info("session.itemCancelled sessionId={} itemId={}", sessionId, itemId);
        return true;
    }

    /**
     * Moves a session to a new status.
     *
     * @param eventData details recorded with the STATUS_CHANGED event
     * @return false if the session does not exist, or if CLOSED was requested for a session
     *         that is already closed
     * @throws IllegalSessionTransitionException if the edge is not allowed
     */
    public boolean transitionStatus(String sessionId, SessionStatus newStatus, Map<String, Object> eventData) {
        Instant now = clock.instant();
        SessionStatus[] previous = new SessionStatus[1];
        Optional<OrderSession> updated = repository.update(sessionId, current -> {
            if (current.status() == SessionStatus.CLOSED && newStatus == SessionStatus.CLOSED) {
                return current;
            }
            if (!current.status().canTransitionTo(newStatus)) {
                throw new IllegalSessionTransitionException(sessionId, current.status(), newStatus);
            }
            previous[0] = current.status();
            OrderSession.Builder builder = current.toBuilder().status(newStatus).lastActivityAt(now);
            if (newStatus == SessionStatus.CLOSED) {
                builder.closedAt(now);
            }
            return builder.build();
        });
        if (updated.isEmpty()) {
            return false;
        }
        if (previous[0] == null) {
            log.info("session.alreadyClosed sessionId={}", sessionId);
            return false;
        }

        Map<String, Object> details = eventData != null ? eventData : Map.of();
        logEvent(sessionId, SessionEventType.STATUS_CHANGED, null, previous[0], newStatus, details);
        if (newStatus == SessionStatus.CLOSED) {
            logEvent(sessionId, SessionEventType.SESSION_CLOSED, null, previous[0], newStatus, details);
            metricsService.incrementSessionClosed(Boolean.TRUE.equals(details.get("orderCreated")));
        }
        log.info("session.transitioned sessionId={} from={} to={}", sessionId, previous[0], newStatus);
        return true;
    }

    /**
     * Flags a session for manual review of its consolidated order.
     */
    public boolean markRequiresReview(String sessionId) {
        return repository.update(sessionId, current -> current.requiresReview()
                ? current
                : current.toBuilder().requiresReview(true).build()).isPresent();
    }

    /**
     * Builds the order request from the session's ACTIVE items and stores it on the session.
     * Line totals use the item's own total, else quantity times unit price, else zero.
     *
     * @return empty if the session is missing, has no active items,
     *         or its conversation has no known customer
     */
    public Optional<OrderRequest> consolidateSession(String sessionId) {
        Optional<OrderSession> found = repository.findById(sessionId);
        List<OrderSessionItem> activeItems = getSessionItems(sessionId);
        if (found.isEmpty() || activeItems.isEmpty()) {
            log.warn("session.consolidationSkipped sessionId={} reason=noItems", sessionId);
            return Optional.empty();
        }
        OrderSession session = found.get();
        Optional<String> customerId = directory.findCustomerId(session.conversationId());
        if (customerId.isEmpty()) {
            log.warn("session.consolidationSkipped sessionId={} reason=unknownCustomer conversationId={}",
                    sessionId, session.conversationId());
            return Optional.empty();
        }

        List<OrderLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (OrderSessionItem item : activeItems) {
            BigDecimal lineTotal = lineTotalOf(item);
            lines.add(new OrderLine(item.productName(), item.quantity(), item.unit(),
                    item.unitPrice() != null ? item.unitPrice() : BigDecimal.ZERO, lineTotal,
                    item.confidence(), item.originalText(), item.suggestedCatalogId(), item.matchingConfidence()));
            total = total.add(lineTotal);
        }

        OrderRequest request = OrderRequest.builder()
                .customerId(customerId.get())
                .distributorId(session.distributorId())
                .conversationId(session.conversationId())
                .lines(lines)
                .totalAmount(total)
                .sourceMessageIds(session.collectedMessageIds())
                .sessionId(sessionId)
                .confidence(session.confidenceScore())
                .requiresReview(session.requiresReview())
                .comment("Consolidated from " + activeItems.size() + " items across "
                        + session.totalMessagesCount() + " messages")
                .build();

        Instant now = clock.instant();
        ConsolidatedSnapshot snapshot = new ConsolidatedSnapshot(request, now, activeItems.size(),
                session.totalMessagesCount());
        repository.update(sessionId, current -> current.toBuilder().consolidatedSnapshot(snapshot).build());

        Map<String, Object> details = new HashMap<>();
        details.put("consolidatedItems", activeItems.size());
        details.put("totalAmount", total.toPlainString());
        details.put("confidenceScore", session.confidenceScore());
        logEvent(sessionId, SessionEventType.SESSION_CONSOLIDATED, null, null, null, details);
        log.info("session.consolidated sessionId={} items={} total={}", sessionId, activeItems.size(), total);
        return Optional.of(request);
    }

    /**
     * Records that the real order was created from this session.
     */
    public boolean recordOrderCreated(String sessionId, String orderId) {
        Optional<OrderSession> updated = repository.update(sessionId, current -> {
            Map<String, String> metadata = new HashMap<>(current.metadata());
            metadata.put("orderId", orderId);
            return current.toBuilder().metadata(metadata).build();
        });
        if (updated.isEmpty()) {
            return false;
        }
        logEvent(sessionId, SessionEventType.ORDER_CREATED, null, null, null, Map.of("orderId", orderId));
        log.info("session.orderCreated sessionId={} orderId={}", sessionId, orderId);
        return true;
    }

    /**
     * Closes every collecting session that has expired by now.
     */
    public int closeExpiredSessions() {
        return closeExpiredSessions(clock.instant());
    }

    /**
     * Closes every ACTIVE or COLLECTING session whose expiry is at or before {@code now}.
     * REVIEWING sessions are being closed by their conversation's own workflow and are left alone.
     *
     * @return the number of sessions closed
     */
    public int closeExpiredSessions(Instant now) {
        List<OrderSession> closed = repository.closeTimedOutSessions(now);
        for (OrderSession session : closed) {
            Map<String, Object> details = Map.of("reason", "timeout", "expiresAt", session.expiresAt().toString());
            logEvent(session.id(), SessionEventType.STATUS_CHANGED, null, session.status(), SessionStatus.CLOSED,
                    details);
            logEvent(session.id(), SessionEventType.SESSION_CLOSED, null, session.status(), SessionStatus.CLOSED,
                    details);
        }
        metricsService.recordExpiredSessions(closed.size());
        if (!closed.isEmpty()) {
            log.info("session.expiredClosed count={}", closed.size());
        }
        return closed.size();
    }

    private Instant extendedExpiry(Instant currentExpiry, Instant now) {
        Instant base = currentExpiry.isAfter(now) ? currentExpiry : now;
        return base.plus(options.getExtensionTimeout());
    }

    private BigDecimal lineTotalOf(OrderSessionItem item) {
        if (item.lineTotal() != null) {
            return item.lineTotal();
        }
        if (item.unitPrice() != null) {
            return item.quantity().multiply(item.unitPrice());
        }
        return BigDecimal.ZERO;
    }

    /**
     * Sets the session confidence to the mean confidence of its active items.
     */
    private void refreshConfidence(String sessionId) {
        List<OrderSessionItem> active = getSessionItems(sessionId);
        double mean = active.stream().mapToDouble(OrderSessionItem::confidence).average().orElse(0.0);
        repository.update(sessionId, current -> current.toBuilder().confidenceScore(mean).build());
    }

    private void logEvent(String sessionId, SessionEventType type, String messageId,
                          SessionStatus previousStatus, SessionStatus newStatus, Map<String, Object> details) {
        repository.appendEvent(SessionEvent.builder()
                .sessionId(sessionId)
                .type(type)
                .messageId(messageId)
                .previousStatus(previousStatus)
                .newStatus(newStatus)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }
}

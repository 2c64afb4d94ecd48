package com.order.consolidation.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link SessionRepository}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>The one-open-session rule is enforced by computing on a conversation index;
 * per-session writes are serialized by computing on the session key.</p>
 */
public class InMemorySessionRepository implements SessionRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, OrderSession> sessions = new ConcurrentHashMap<>();
    // conversationId -> id of its open session
    private final ConcurrentMap<String, String> openByConversation = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<OrderSessionItem>> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<SessionEvent>> events = new ConcurrentHashMap<>();

    @Override
    public OrderSession insertIfNoOpenSession(OrderSession session) {
        openByConversation.compute(session.conversationId(), (conversationId, existingId) -> {
            if (existingId != null) {
                OrderSession existing = sessions.get(existingId);
                if (existing != null && existing.status().isOpen()) {
                    throw new DuplicateSessionException(conversationId, existingId);
                }
            }
            sessions.put(session.id(), session);
            return session.status().isOpen() ? session.id() : null;
        });
        log.debug("session.inserted sessionId={} conversationId={}", session.id(), session.conversationId());
        return session;
    }

    @Override
    public Optional<OrderSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<OrderSession> findByConversation(String conversationId) {
        return sessions.values().stream()
                .filter(s -> conversationId.equals(s.conversationId()))
                .sorted(Comparator.comparing(OrderSession::startedAt))
                .toList();
    }

    @Override
    public Optional<OrderSession> update(String sessionId, UnaryOperator<OrderSession> updater) {
        OrderSession updated = sessions.computeIfPresent(sessionId, (id, current) -> updater.apply(current));
        if (updated != null && !updated.status().isOpen()) {
            openByConversation.remove(updated.conversationId(), updated.id());
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public Optional<OrderSessionItem> appendItem(String sessionId, Predicate<OrderSession> precondition,
                                                 IntFunction<OrderSessionItem> itemFactory) {
        List<OrderSessionItem> created = new ArrayList<>(1);
        // holding the session key keeps a concurrent close from slipping between check and append
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (precondition.test(current)) {
                items.compute(sessionId, (key, list) -> {
                    List<OrderSessionItem> target = list != null ? list : new CopyOnWriteArrayList<>();
                    OrderSessionItem item = itemFactory.apply(target.size() + 1);
                    target.add(item);
                    created.add(item);
                    return target;
                });
            }
            return current;
        });
        return created.stream().findFirst();
    }

    @Override
    public Optional<OrderSessionItem> updateItem(String sessionId, String itemId,
                                                 UnaryOperator<OrderSessionItem> updater) {
        List<OrderSessionItem> updated = new ArrayList<>(1);
        items.computeIfPresent(sessionId, (id, list) -> {
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).id().equals(itemId)) {
                    OrderSessionItem replacement = updater.apply(list.get(i));
                    list.set(i, replacement);
                    updated.add(replacement);
                    break;
                }
            }
            return list;
        });
        return updated.stream().findFirst();
    }

    @Override
    public List<OrderSessionItem> findItems(String sessionId) {
        List<OrderSessionItem> list = items.get(sessionId);
        if (list == null) {
            return List.of();
        }
        return list.stream()
                .sorted(Comparator.comparingInt(OrderSessionItem::sequenceNumber))
                .toList();
    }

    @Override
    public void appendEvent(SessionEvent event) {
        events.computeIfAbsent(event.sessionId(), k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<SessionEvent> findEvents(String sessionId) {
        List<SessionEvent> list = events.get(sessionId);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public List<OrderSession> closeTimedOutSessions(Instant now) {
        List<OrderSession> closed = new ArrayList<>();
        for (String sessionId : List.copyOf(sessions.keySet())) {
            List<OrderSession> before = new ArrayList<>(1);
            update(sessionId, current -> {
                if (!current.status().isCollecting() || !current.isExpiredAt(now)) {
                    return current;
                }
                before.add(current);
                return current.toBuilder()
                        .status(SessionStatus.CLOSED)
                        .closedAt(now)
                        .build();
            });
            closed.addAll(before);
        }
        if (!closed.isEmpty()) {
            log.debug("session.timedOut count={}", closed.size());
        }
        return closed;
    }

    /**
     * Number of stored sessions, open or closed.
     */
    public int size() {
        return sessions.size();
    }
}

package com.order.consolidation.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Storage for order sessions, their items and their event logs.
 *
 * <p>Implementations guarantee at most one open (non-CLOSED) session per conversation and
 * apply updates to a single session atomically.</p>
 */
public interface SessionRepository {

    /**
     * Inserts a new session unless its conversation already has an open one.
     *
     * @return the stored session
     * @throws DuplicateSessionException if an open session exists for the conversation
     */
    OrderSession insertIfNoOpenSession(OrderSession session);

    Optional<OrderSession> findById(String sessionId);

    /**
     * Returns every session of the conversation, open or closed.
     */
    List<OrderSession> findByConversation(String conversationId);

    /**
     * Atomically replaces a session with the result of {@code updater}.
     * Exceptions thrown by the updater propagate and leave the session unchanged.
     *
     * @return the updated session, or empty if no session has that id
     */
    Optional<OrderSession> update(String sessionId, UnaryOperator<OrderSession> updater);

    /**
     * Appends an item to a session if {@code precondition} holds for the session, passing the next
     * sequence number (starting at 1) to the factory. The check and the append are atomic with
     * respect to {@link #update}.
     *
     * @return the stored item, or empty if the session is missing or the precondition failed
     */
    Optional<OrderSessionItem> appendItem(String sessionId, Predicate<OrderSession> precondition,
                                          IntFunction<OrderSessionItem> itemFactory);

    /**
     * Atomically replaces an item with the result of {@code updater}.
     *
     * @return the updated item, or empty if the session has no such item
     */
    Optional<OrderSessionItem> updateItem(String sessionId, String itemId, UnaryOperator<OrderSessionItem> updater);

    /**
     * Returns every item of the session, cancelled ones included, in sequence order.
     */
    List<OrderSessionItem> findItems(String sessionId);

    void appendEvent(SessionEvent event);

    /**
     * Returns the session's events in insertion order.
     */
    List<SessionEvent> findEvents(String sessionId);

    /**
     * Closes every ACTIVE or COLLECTING session whose expiry is at or before {@code now}.
     * Sessions expiring after {@code now} are never touched, and neither are REVIEWING ones,
     * which their conversation is already closing.
     *
     * @return the sessions as they were just before being closed
     */
    List<OrderSession> closeTimedOutSessions(Instant now);
}

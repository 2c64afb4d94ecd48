package com.order.consolidation.lock;

/**
 * Lock serializing the read-then-write session sequence of a single conversation.
 */
public interface ConversationLock {

    /**
     * Acquires the lock for the given conversation.
     *
     * @param conversationId the conversation key
     * @throws LockAcquisitionException if the lock cannot be acquired within the timeout
     */
    void lock(String conversationId);

    /**
     * Releases the lock for the given conversation. A no-op if the caller does not hold it.
     */
    void unlock(String conversationId);
}

package com.order.consolidation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process conversation lock using one {@link ReentrantLock} per conversation.
 * Suitable for single-JVM deployments.
 *
 * <p>Entries are reference counted and removed once no thread holds or waits for them,
 * so the map only contains conversations currently being processed.</p>
 */
public class LocalConversationLock implements ConversationLock {
    private static final Logger log = LoggerFactory.getLogger(LocalConversationLock.class);

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalConversationLock() {
        this(LockConfig.defaults());
    }

    public LocalConversationLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String conversationId) {
        Entry entry = locks.compute(conversationId, (k, current) -> {
            Entry target = current != null ? current : new Entry();
            target.references++;
            return target;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for conversation '" + conversationId
                                + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("lock.acquired conversationId={}", conversationId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(
                    "Interrupted while acquiring lock for conversation: " + conversationId, e);
        } finally {
            if (!acquired) {
                release(conversationId);
            }
        }
    }

    @Override
    public void unlock(String conversationId) {
        Entry entry = locks.get(conversationId);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(conversationId);
            log.debug("lock.released conversationId={}", conversationId);
        }
    }

    /**
     * Number of conversations with a held or awaited lock.
     */
    public int activeLocks() {
        return locks.size();
    }

    private void release(String conversationId) {
        locks.computeIfPresent(conversationId, (k, entry) -> --entry.references == 0 ? null : entry);
    }

    // references is only touched inside compute on the entry's key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}

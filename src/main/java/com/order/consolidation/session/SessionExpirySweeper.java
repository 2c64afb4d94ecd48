package com.order.consolidation.session;

import com.order.consolidation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically closes expired sessions on a single daemon thread.
 *
 * <p>A failing sweep is logged and the next one still runs.</p>
 */
public class SessionExpirySweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionExpirySweeper.class);

    private final OrderSessionManager sessionManager;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public SessionExpirySweeper(OrderSessionManager sessionManager, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.sessionManager = sessionManager;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "order-session-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules the sweep. Calling start twice has no further effect.
     */
    public synchronized void start() {
        if (task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        log.info("sweeper.started intervalMs={}", millis);
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return the number of sessions closed, or 0 if the sweep failed
     */
    public int runOnce() {
        try (LogContext ctx = LogContext.forSweep()) {
            int closed = sessionManager.closeExpiredSessions();
            log.debug("sweeper.completed closed={}", closed);
            return closed;
        } catch (RuntimeException e) {
            log.error("sweeper.failed error={}", e.getMessage(), e);
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("sweeper.stopped");
    }
}

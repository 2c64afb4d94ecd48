package com.order.consolidation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMessage(messageId, conversationId)) {
 *     log.info("session.started sessionId={}", sessionId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for processing one inbound message.
     */
    public static LogContext forMessage(String messageId, String conversationId) {
        LogContext ctx = new LogContext();
        ctx.put("messageId", messageId);
        ctx.put("conversationId", conversationId);
        ctx.put("operation", "process");
        return ctx;
    }

    /**
     * Creates a log context for operations on a single session.
     */
    public static LogContext forSession(String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("operation", "session");
        return ctx;
    }

    /**
     * Creates a log context for a background expiry sweep.
     */
    public static LogContext forSweep() {
        LogContext ctx = new LogContext();
        ctx.put("operation", "sweep");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}

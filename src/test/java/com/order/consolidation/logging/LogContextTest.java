package com.order.consolidation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forMessage should set messageId, conversationId, and operation in MDC")
    void forMessageSetsMDC() {
        try (LogContext ctx = LogContext.forMessage("msg-1", "conv-1")) {
            assertEquals("msg-1", MDC.get("messageId"));
            assertEquals("conv-1", MDC.get("conversationId"));
            assertEquals("process", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSession and forSweep should set their keys")
    void sessionAndSweepSetMDC() {
        try (LogContext ctx = LogContext.forSession("session-1")) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("session", MDC.get("operation"));
        }
        try (LogContext ctx = LogContext.forSweep()) {
            assertEquals("sweep", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Null values are not put in MDC")
    void nullValuesSkipped() {
        try (LogContext ctx = LogContext.forMessage("msg-1", null)) {
            assertEquals("msg-1", MDC.get("messageId"));
            assertNull(MDC.get("conversationId"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC, including extra keys")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forMessage("msg-1", "conv-1").with("customerId", "cust-1")) {
            assertEquals("cust-1", MDC.get("customerId"));
        }
        assertNull(MDC.get("messageId"));
        assertNull(MDC.get("conversationId"));
        assertNull(MDC.get("customerId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested session context keeps the message keys")
    void nestedContexts() {
        try (LogContext outer = LogContext.forMessage("msg-1", "conv-1")) {
            try (LogContext inner = LogContext.forSession("session-1")) {
                assertEquals("session-1", MDC.get("sessionId"));
                assertEquals("msg-1", MDC.get("messageId"));
            }
            assertNull(MDC.get("sessionId"));
            assertEquals("conv-1", MDC.get("conversationId"));
        }
        assertNull(MDC.get("conversationId"));
    }
}

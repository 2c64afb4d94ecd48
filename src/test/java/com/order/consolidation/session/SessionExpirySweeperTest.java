package com.order.consolidation.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionExpirySweeper Tests")
class SessionExpirySweeperTest {

    @Mock
    private OrderSessionManager sessionManager;

    @Test
    @DisplayName("Interval must be positive")
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new SessionExpirySweeper(sessionManager, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionExpirySweeper(sessionManager, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> new SessionExpirySweeper(sessionManager, null));
    }

    @Test
    @DisplayName("Single sweep returns the number of closed sessions")
    void runOnce() {
        when(sessionManager.closeExpiredSessions()).thenReturn(3);

        try (SessionExpirySweeper sweeper = new SessionExpirySweeper(sessionManager, Duration.ofMinutes(1))) {
            assertEquals(3, sweeper.runOnce());
        }
    }

    @Test
    @DisplayName("Failing sweep is contained")
    void failingSweep() {
        when(sessionManager.closeExpiredSessions()).thenThrow(new IllegalStateException("store down"));

        try (SessionExpirySweeper sweeper = new SessionExpirySweeper(sessionManager, Duration.ofMinutes(1))) {
            assertEquals(0, sweeper.runOnce());
        }
    }

    @Test
    @DisplayName("Scheduled sweeps keep running after a failure")
    void scheduledSweeps() {
        when(sessionManager.closeExpiredSessions())
                .thenThrow(new IllegalStateException("store down"))
                .thenReturn(0);

        try (SessionExpirySweeper sweeper = new SessionExpirySweeper(sessionManager, Duration.ofMillis(20))) {
            sweeper.start();
            sweeper.start();
            assertTrue(sweeper.isRunning());

            verify(sessionManager, timeout(2000).atLeast(3)).closeExpiredSessions();
        }
    }

    @Test
    @DisplayName("Close stops the schedule")
    void closeStops() {
        SessionExpirySweeper sweeper = new SessionExpirySweeper(sessionManager, Duration.ofMinutes(1));
        sweeper.start();

        sweeper.close();

        assertFalse(sweeper.isRunning());
    }
}

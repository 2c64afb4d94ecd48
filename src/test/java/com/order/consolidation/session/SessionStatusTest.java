package com.order.consolidation.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionStatus Tests")
class SessionStatusTest {

    @ParameterizedTest
    @CsvSource({
            "ACTIVE, COLLECTING, true",
            "ACTIVE, CLOSED, true",
            "ACTIVE, REVIEWING, false",
            "COLLECTING, REVIEWING, true",
            "COLLECTING, CLOSED, true",
            "COLLECTING, ACTIVE, false",
            "REVIEWING, CLOSED, true",
            "REVIEWING, COLLECTING, false",
            "CLOSED, ACTIVE, false",
            "CLOSED, CLOSED, false"
    })
    @DisplayName("Only state machine edges are allowed")
    void transitions(SessionStatus from, SessionStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @ParameterizedTest
    @EnumSource(SessionStatus.class)
    @DisplayName("No state transitions to itself")
    void noSelfTransition(SessionStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    @DisplayName("Open and collecting states")
    void openAndCollecting() {
        assertTrue(SessionStatus.ACTIVE.isCollecting());
        assertTrue(SessionStatus.COLLECTING.isCollecting());
        assertFalse(SessionStatus.REVIEWING.isCollecting());
        assertTrue(SessionStatus.REVIEWING.isOpen());
        assertFalse(SessionStatus.CLOSED.isOpen());
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.CircuitBreakerState;
import com.autonomous.treasury.store.FileLedgerStore;
import com.autonomous.treasury.support.TreasuryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerServiceTest {

    @TempDir
    Path tempDir;

    private TreasuryFixture fx;

    @BeforeEach
    void setUp() {
        fx = new TreasuryFixture(new FileLedgerStore(tempDir));
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void shouldStartOpen() {
        assertFalse(fx.circuitBreaker.isFrozen());
        assertNull(fx.circuitBreaker.getState().getActor());
    }

    @Test
    void shouldFreezeAndLogWhoAndWhy() {
        CircuitBreakerState state = fx.circuitBreaker.freeze("runaway spend", "alice");

        assertTrue(state.isFrozen());
        assertTrue(fx.circuitBreaker.isFrozen());
        assertEquals("alice", fx.circuitBreaker.getState().getActor());

        List<AdminEvent> events = fx.adminLog.getEvents(null, null);
        assertEquals(1, events.size());
        assertEquals(AdminEventType.FREEZE, events.get(0).getType());
        assertEquals("runaway spend", events.get(0).getReason());
    }

    @Test
    void shouldBeVisibleToEveryInstanceSharingTheStore() {
        CircuitBreakerService other = new CircuitBreakerService(fx.cacheStore, fx.adminLog, fx.opsAlert, fx.clock);

        fx.circuitBreaker.freeze("incident", "ops");
        assertTrue(other.isFrozen());

        other.unfreeze("resolved", "ops");
        assertFalse(fx.circuitBreaker.isFrozen());
    }

    @Test
    void shouldRestoreLastStateFromAdminLog() {
        fx.circuitBreaker.freeze("incident", "ops");

        TreasuryFixture restarted = new TreasuryFixture(fx.ledgerStore);
        try {
            assertFalse(restarted.circuitBreaker.isFrozen());
            restarted.circuitBreaker.restore();
            assertTrue(restarted.circuitBreaker.isFrozen());
            assertEquals("incident", restarted.circuitBreaker.getState().getReason());
        } finally {
            restarted.close();
        }
    }

    @Test
    void shouldRequireReasonAndActor() {
        assertThrows(IllegalArgumentException.class, () -> fx.circuitBreaker.freeze(" ", "ops"));
        assertThrows(IllegalArgumentException.class, () -> fx.circuitBreaker.unfreeze("done", null));
        assertFalse(fx.circuitBreaker.isFrozen());
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.store.FileLedgerStore;
import com.autonomous.treasury.support.TreasuryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DailyResetSchedulerTest {

    @TempDir
    Path tempDir;

    private TreasuryFixture fx;
    private DailyResetScheduler scheduler;

    @BeforeEach
    void setUp() {
        fx = new TreasuryFixture(new FileLedgerStore(tempDir));
        scheduler = new DailyResetScheduler(fx.registry, fx.ledgerStore);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void shouldDoNothingBeforeMidnight() {
        fx.registry.provision("agent_a", 5000L, 3000L, 1000L, null, "test");
        fx.registry.authorize("agent_a", 800, "call", null);

        assertEquals(0, scheduler.sweep());
        assertEquals(800, fx.registry.getBudget("agent_a").getSpentToday());
    }

    @Test
    void shouldResetIdleAgentsAfterMidnight() {
        fx.registry.provision("agent_a", 5000L, 3000L, 1000L, null, "test");
        fx.registry.provision("agent_b", 5000L, 3000L, 1000L, null, "test");
        fx.registry.authorize("agent_a", 800, "call", null);

        fx.clock.advance(Duration.ofDays(1));

        assertEquals(2, scheduler.sweep());
        assertEquals(0, fx.registry.getBudget("agent_a").getSpentToday());
        assertEquals(LocalDate.of(2024, 3, 11), fx.registry.getBudget("agent_b").getLastResetDate());
        // balance is never touched by a reset
        assertEquals(4200, fx.registry.getBudget("agent_a").getCurrentBalance());

        assertEquals(0, scheduler.sweep());
    }
}

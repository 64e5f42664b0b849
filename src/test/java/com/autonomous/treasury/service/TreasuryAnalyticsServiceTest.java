package com.autonomous.treasury.service;

import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.TreasuryAnalytics;
import com.autonomous.treasury.store.FileLedgerStore;
import com.autonomous.treasury.support.TreasuryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TreasuryAnalyticsServiceTest {

    @TempDir
    Path tempDir;

    private TreasuryFixture fx;
    private TreasuryAnalyticsService analytics;

    @BeforeEach
    void setUp() {
        fx = new TreasuryFixture(new FileLedgerStore(tempDir));
        analytics = new TreasuryAnalyticsService(fx.registry, fx.circuitBreaker, fx.ledger, fx.writeQueue, fx.clock);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void shouldSummarizeAllBudgets() {
        fx.registry.provision("agent_a", 5000L, 3000L, 1000L, null, "test");
        fx.registry.provision("agent_b", 2000L, 3000L, 1000L, null, "test");
        fx.registry.authorize("agent_a", 1000, "call", null);
        fx.registry.setStatus("agent_b", BudgetStatus.SUSPENDED, "ops", "review");
        fx.circuitBreaker.freeze("incident", "ops");

        TreasuryAnalytics result = analytics.getAnalytics();

        assertEquals(2, result.getTotalAgents());
        assertEquals(1L, result.getAgentsByStatus().get(BudgetStatus.ACTIVE));
        assertEquals(1L, result.getAgentsByStatus().get(BudgetStatus.SUSPENDED));
        assertEquals(6000, result.getTotalBalance());
        assertEquals(1000, result.getTotalSpentToday());
        assertEquals(7000, result.getTotalEarned());
        assertTrue(result.isFrozen());
        assertEquals(0, result.getDegradedAuditWrites());
    }

    @Test
    void shouldReportNoRoiBeforeAnySpend() {
        TreasuryAnalytics result = analytics.getAnalytics();

        assertEquals(0, result.getTotalAgents());
        assertNull(result.getSystemRoi());
        assertNull(result.getTopPerformer());
    }
}

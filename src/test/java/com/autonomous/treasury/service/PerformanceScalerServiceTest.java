package com.autonomous.treasury.service;

import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.PerformanceSnapshot;
import com.autonomous.treasury.model.PerformanceTier;
import com.autonomous.treasury.model.RescaleResult;
import com.autonomous.treasury.model.RoiData;
import com.autonomous.treasury.store.FileLedgerStore;
import com.autonomous.treasury.support.TreasuryFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceScalerServiceTest {

    @TempDir
    Path tempDir;

    private TreasuryFixture fx;
    private BudgetRegistryService registry;
    private PerformanceScalerService scaler;

    @BeforeEach
    void setUp() {
        fx = new TreasuryFixture(new FileLedgerStore(tempDir));
        registry = fx.registry;
        scaler = fx.scaler;
        registry.provision("agent_a", 100000L, 10000L, 1000L, null, "test");
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void shouldApplyExcellentMultiplierAtExactlyTwo() {
        registry.authorize("agent_a", 1000, "call", null);
        registry.authorize("agent_a", 1000, "call", null);
        registry.recordEarning("agent_a", 4000, "sale", null);

        RescaleResult result = scaler.rescale("agent_a");

        assertEquals(PerformanceTier.EXCELLENT, result.getTier());
        assertEquals(2.0, result.getRoi(), 1e-9);
        assertEquals(15000, result.getNewDailyLimit());
        assertEquals(1500, result.getNewPerActionLimit());

        AgentBudget budget = registry.getBudget("agent_a");
        assertEquals(15000, budget.getDailyLimit());
        assertEquals(2.0, budget.getRoiScore(), 1e-9);
        assertEquals(100000 - 2000 + 4000, budget.getCurrentBalance());
        assertTrue(fx.adminLog.getEvents(null, null).stream()
            .anyMatch(e -> e.getType() == AdminEventType.LIMITS_RESCALED));
    }

    @Test
    void shouldKeepLimitsAtNeutralBoundary() {
        for (int i = 0; i < 5; i++) {
            registry.authorize("agent_a", 1000, "call", null);
        }
        registry.recordEarning("agent_a", 4000, "sale", null);

        RescaleResult result = scaler.rescale("agent_a");

        assertEquals(PerformanceTier.NEUTRAL, result.getTier());
        assertEquals(10000, result.getNewDailyLimit());
        assertEquals(1000, result.getNewPerActionLimit());
    }

    @Test
    void shouldCountRealizedValueReportedOnSpends() {
        RoiData roi = RoiData.builder().toolUsed("search").expectedValue(2000L).realizedValue(1600L).build();
        registry.authorize("agent_a", 1000, "search", roi);

        PerformanceSnapshot snapshot = scaler.snapshot("agent_a");

        assertEquals(1000, snapshot.getTotalSpent());
        assertEquals(1600, snapshot.getTotalValueGenerated());
        assertEquals(PerformanceTier.GOOD, snapshot.tier());
    }

    @Test
    void shouldHalveLimitsForCriticalRoiWithoutGoingBelowSpentToday() {
        registry.authorize("agent_a", 1000, "call", null);
        registry.authorize("agent_a", 1000, "call", null);

        RescaleResult result = scaler.rescale("agent_a");

        assertEquals(PerformanceTier.CRITICAL, result.getTier());
        assertEquals(5000, result.getNewDailyLimit());
        assertEquals(500, result.getNewPerActionLimit());

        fx.clock.advance(Duration.ofMinutes(1));
        for (int i = 0; i < 6; i++) {
            registry.authorize("agent_a", 500, "call", null);
        }
        // 5000 * 0.5 = 2500, but 5000 is already spent today
        assertEquals(5000, scaler.rescale("agent_a").getNewDailyLimit());
    }

    @Test
    void shouldClampToCeiling() {
        scaler.setDailyBounds(1000, 12000);
        scaler.setActionBounds(100, 1200);
        registry.authorize("agent_a", 1000, "call", null);
        registry.recordEarning("agent_a", 5000, "sale", null);

        RescaleResult result = scaler.rescale("agent_a");

        assertEquals(12000, result.getNewDailyLimit());
        assertEquals(1200, result.getNewPerActionLimit());
    }

    @Test
    void shouldNotLiftNeutralLimitsThatSitBelowFloor() {
        registry.provision("agent_small", 100000L, 500L, 400L, null, "test");
        registry.authorize("agent_small", 400, "call", null);
        registry.recordEarning("agent_small", 400, "sale", null);

        RescaleResult result = scaler.rescale("agent_small");

        assertEquals(PerformanceTier.NEUTRAL, result.getTier());
        assertEquals(500, result.getNewDailyLimit());
        assertEquals(400, result.getNewPerActionLimit());
        AgentBudget budget = registry.getBudget("agent_small");
        assertEquals(500, budget.getDailyLimit());
        assertEquals(400, budget.getPerActionLimit());
    }

    @Test
    void shouldNotLowerNeutralPerActionAboveDaily() {
        registry.provision("agent_wide", 100000L, 2000L, 3000L, null, "test");
        registry.authorize("agent_wide", 1000, "call", null);
        registry.recordEarning("agent_wide", 1000, "sale", null);

        RescaleResult result = scaler.rescale("agent_wide");

        assertEquals(PerformanceTier.NEUTRAL, result.getTier());
        assertEquals(2000, result.getNewDailyLimit());
        assertEquals(3000, result.getNewPerActionLimit());
    }

    @Test
    void shouldNotLowerExcellentLimitsAboveCeiling() {
        registry.provision("agent_big", 1000000L, 100000L, 20000L, null, "test");
        registry.authorize("agent_big", 1000, "call", null);
        registry.recordEarning("agent_big", 3000, "sale", null);

        RescaleResult result = scaler.rescale("agent_big");

        assertEquals(PerformanceTier.EXCELLENT, result.getTier());
        assertEquals(100000, result.getNewDailyLimit());
        assertEquals(20000, result.getNewPerActionLimit());
        assertEquals(100000, registry.getBudget("agent_big").getDailyLimit());
    }

    @Test
    void shouldNotRaiseCriticalLimitsBelowFloor() {
        registry.provision("agent_tiny", 100000L, 500L, 50L, null, "test");
        registry.authorize("agent_tiny", 50, "call", null);

        RescaleResult result = scaler.rescale("agent_tiny");

        assertEquals(PerformanceTier.CRITICAL, result.getTier());
        assertEquals(500, result.getNewDailyLimit());
        assertEquals(50, result.getNewPerActionLimit());
        AgentBudget budget = registry.getBudget("agent_tiny");
        assertEquals(500, budget.getDailyLimit());
        assertEquals(50, budget.getPerActionLimit());
    }

    @Test
    void shouldLeaveAgentWithoutSpendUntouched() {
        RescaleResult result = scaler.rescale("agent_a");

        assertEquals(PerformanceTier.NO_DATA, result.getTier());
        assertFalse(result.isApplied());
        assertNull(result.getRoi());
        assertEquals(10000, registry.getBudget("agent_a").getDailyLimit());
    }

    @Test
    void shouldIgnoreActivityOutsideWindow() {
        registry.authorize("agent_a", 1000, "old call", null);
        fx.clock.advance(Duration.ofDays(8));

        assertEquals(PerformanceTier.NO_DATA, scaler.snapshot("agent_a").tier());
    }

    @Test
    void shouldSkipInactiveAgentsInPeriodicRun() {
        registry.provision("agent_b", 100000L, 10000L, 1000L, null, "test");
        registry.authorize("agent_a", 1000, "call", null);
        registry.authorize("agent_b", 1000, "call", null);
        registry.setStatus("agent_b", BudgetStatus.SUSPENDED, "ops", "review");

        List<RescaleResult> results = scaler.rescaleAll();

        assertEquals(1, results.size());
        assertEquals("agent_a", results.get(0).getAgentId());
        assertEquals(10000, registry.getBudget("agent_b").getDailyLimit());
    }
}

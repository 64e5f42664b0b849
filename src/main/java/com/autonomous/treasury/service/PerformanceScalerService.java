package com.autonomous.treasury.service;

import com.autonomous.treasury.exception.TreasuryException;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.PerformanceSnapshot;
import com.autonomous.treasury.model.PerformanceTier;
import com.autonomous.treasury.model.RescaleResult;
import com.autonomous.treasury.model.Transaction;
import com.autonomous.treasury.model.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rescales an agent's spending ceilings from its realized ROI over a trailing window.
 *
 * <p>ROI is value generated (earnings plus {@code realizedValue} reported on spends) divided by
 * the amount spent, over the last {@code windowDays} days and at most {@code maxTransactions}
 * transactions. Only {@code dailyLimit}, {@code perActionLimit} and {@code roiScore} are
 * touched; the balance never is.</p>
 */
@Slf4j
@Service
public class PerformanceScalerService {

    private final BudgetCache budgetCache;
    private final BudgetRegistryService registry;
    private final TransactionLedgerService ledger;
    private final AdminLogService adminLog;
    private final Clock clock;

    @Value("${treasury.scaling.window-days:7}")
    private int windowDays = 7;

    @Value("${treasury.scaling.max-transactions:500}")
    private int maxTransactions = 500;

    @Value("${treasury.scaling.daily-floor:1000}")
    private long dailyFloor = 1000;

    @Value("${treasury.scaling.daily-ceiling:50000}")
    private long dailyCeiling = 50000;

    @Value("${treasury.scaling.action-floor:100}")
    private long actionFloor = 100;

    @Value("${treasury.scaling.action-ceiling:10000}")
    private long actionCeiling = 10000;

    public PerformanceScalerService(BudgetCache budgetCache, BudgetRegistryService registry,
                                    TransactionLedgerService ledger, AdminLogService adminLog, Clock clock) {
        this.budgetCache = budgetCache;
        this.registry = registry;
        this.ledger = ledger;
        this.adminLog = adminLog;
        this.clock = clock;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public void setDailyBounds(long floor, long ceiling) {
        this.dailyFloor = floor;
        this.dailyCeiling = ceiling;
    }

    public void setActionBounds(long floor, long ceiling) {
        this.actionFloor = floor;
        this.actionCeiling = ceiling;
    }

    public PerformanceSnapshot snapshot(String agentId) {
        String id = BudgetRegistryService.normalizeAgentId(agentId);
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(windowDays));

        List<Transaction> window = ledger.getTransactions(id, start, end.plusNanos(1));
        if (window.size() > maxTransactions) {
            window = window.subList(window.size() - maxTransactions, window.size());
        }

        long spent = 0;
        long value = 0;
        for (Transaction tx : window) {
            if (!tx.isSuccessful()) {
                continue;
            }
            if (tx.getType() == TransactionType.SPENDING) {
                spent += Math.abs(tx.getAmount());
                if (tx.getRoiData() != null && tx.getRoiData().getRealizedValue() != null) {
                    value += tx.getRoiData().getRealizedValue();
                }
            } else if (tx.getType() == TransactionType.EARNING) {
                value += tx.getAmount();
            }
        }
        return PerformanceSnapshot.builder()
            .agentId(id)
            .windowStart(start)
            .windowEnd(end)
            .totalSpent(spent)
            .totalValueGenerated(value)
            .transactionCount(window.size())
            .build();
    }

    public RescaleResult rescale(String agentId) {
        PerformanceSnapshot snapshot = snapshot(agentId);
        PerformanceTier tier = snapshot.tier();
        Double roi = snapshot.hasSpend() ? snapshot.roi() : null;

        BudgetUpdate<RescaleResult> outcome = budgetCache.update(snapshot.getAgentId(), budget -> {
            long oldDaily = budget.getDailyLimit();
            long oldAction = budget.getPerActionLimit();
            if (tier == PerformanceTier.NO_DATA) {
                return BudgetUpdate.skip(budget, RescaleResult.builder()
                    .agentId(budget.getAgentId())
                    .tier(tier)
                    .multiplier(tier.multiplier())
                    .oldDailyLimit(oldDaily)
                    .newDailyLimit(oldDaily)
                    .oldPerActionLimit(oldAction)
                    .newPerActionLimit(oldAction)
                    .applied(false)
                    .build());
            }
            long newDaily = toward(oldDaily, clamp(scale(oldDaily, tier), dailyFloor, dailyCeiling), tier);
            if (tier.multiplier() < 1.0) {
                // never below what was already spent today
                newDaily = Math.min(oldDaily, Math.max(newDaily, budget.getSpentToday()));
            }
            long newAction = toward(oldAction, clamp(scale(oldAction, tier), actionFloor, actionCeiling), tier);
            if (tier.multiplier() != 1.0) {
                newAction = toward(oldAction, Math.min(newAction, newDaily), tier);
            }

            boolean changed = newDaily != oldDaily || newAction != oldAction
                || (roi != null && roi != budget.getRoiScore());
            RescaleResult result = RescaleResult.builder()
                .agentId(budget.getAgentId())
                .tier(tier)
                .roi(roi)
                .multiplier(tier.multiplier())
                .oldDailyLimit(oldDaily)
                .newDailyLimit(newDaily)
                .oldPerActionLimit(oldAction)
                .newPerActionLimit(newAction)
                .applied(changed)
                .build();
            if (!changed) {
                return BudgetUpdate.skip(budget, result);
            }
            budget.setDailyLimit(newDaily);
            budget.setPerActionLimit(newAction);
            if (roi != null) {
                budget.setRoiScore(roi);
            }
            return BudgetUpdate.commit(budget, result);
        });

        RescaleResult result = outcome.getResult();
        if (outcome.isCommitted()) {
            adminLog.record(AdminEventType.LIMITS_RESCALED, result.getAgentId(), "performance-scaler",
                tier.name().toLowerCase(),
                String.format("roi=%s daily %d -> %d, perAction %d -> %d", roi,
                    result.getOldDailyLimit(), result.getNewDailyLimit(),
                    result.getOldPerActionLimit(), result.getNewPerActionLimit()));
            log.info("Rescaled {} ({}, roi={}): daily {} -> {}, perAction {} -> {}", result.getAgentId(), tier, roi,
                result.getOldDailyLimit(), result.getNewDailyLimit(),
                result.getOldPerActionLimit(), result.getNewPerActionLimit());
        } else {
            log.debug("No rescale for {} ({})", result.getAgentId(), tier);
        }
        return result;
    }

    @Scheduled(cron = "${treasury.scaling.cron:0 0 3 * * *}")
    public void scheduledRescale() {
        rescaleAll();
    }

    public List<RescaleResult> rescaleAll() {
        List<RescaleResult> results = new ArrayList<>();
        for (AgentBudget budget : registry.listBudgets()) {
            if (!budget.isActive()) {
                continue;
            }
            try {
                results.add(rescale(budget.getAgentId()));
            } catch (TreasuryException e) {
                log.warn("Rescale of {} failed: {}", budget.getAgentId(), e.getMessage());
            }
        }
        log.info("Periodic rescale finished: {} agents, {} changed", results.size(),
            results.stream().filter(RescaleResult::isApplied).count());
        return results;
    }

    private static long scale(long limit, PerformanceTier tier) {
        return (long) Math.floor(limit * tier.multiplier());
    }

    /**
     * Keeps the clamped value on the tier's side of {@code current}: growth tiers never lower a
     * limit, shrink tiers never raise one, and a neutral tier leaves it as is.
     */
    private static long toward(long current, long target, PerformanceTier tier) {
        if (tier.multiplier() > 1.0) {
            return Math.max(current, target);
        }
        if (tier.multiplier() < 1.0) {
            return Math.min(current, target);
        }
        return current;
    }

    private static long clamp(long value, long floor, long ceiling) {
        return Math.max(floor, Math.min(ceiling, value));
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.TreasuryAnalytics;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class TreasuryAnalyticsService {

    private final BudgetRegistryService registry;
    private final CircuitBreakerService circuitBreaker;
    private final TransactionLedgerService ledger;
    private final DurableWriteQueue writeQueue;
    private final Clock clock;

    public TreasuryAnalyticsService(BudgetRegistryService registry, CircuitBreakerService circuitBreaker,
                                    TransactionLedgerService ledger, DurableWriteQueue writeQueue, Clock clock) {
        this.registry = registry;
        this.circuitBreaker = circuitBreaker;
        this.ledger = ledger;
        this.writeQueue = writeQueue;
        this.clock = clock;
    }

    public TreasuryAnalytics getAnalytics() {
        List<AgentBudget> budgets = registry.listBudgets();

        Map<BudgetStatus, Long> byStatus = new EnumMap<>(BudgetStatus.class);
        for (BudgetStatus status : BudgetStatus.values()) {
            byStatus.put(status, 0L);
        }
        long balance = 0;
        long spentToday = 0;
        long spent = 0;
        long earned = 0;
        for (AgentBudget budget : budgets) {
            byStatus.merge(budget.getStatus(), 1L, Long::sum);
            balance += budget.getCurrentBalance();
            spentToday += budget.getSpentToday();
            spent += budget.getTotalSpent();
            earned += budget.getTotalEarned();
        }
        String topPerformer = budgets.stream()
            .filter(b -> b.getRoiScore() > 1.0)
            .max(Comparator.comparingDouble(AgentBudget::getRoiScore))
            .map(AgentBudget::getAgentId)
            .orElse(null);

        return TreasuryAnalytics.builder()
            .totalAgents(budgets.size())
            .agentsByStatus(byStatus)
            .totalBalance(balance)
            .totalSpentToday(spentToday)
            .totalSpent(spent)
            .totalEarned(earned)
            .systemRoi(spent > 0 ? (double) earned / spent : null)
            .topPerformer(topPerformer)
            .frozen(circuitBreaker.isFrozen())
            .pendingDurableWrites(writeQueue.pendingCount())
            .degradedAuditWrites(ledger.degradedWriteCount())
            .generatedAt(clock.instant())
            .build();
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.exception.AgentInactiveException;
import com.autonomous.treasury.exception.AuditWriteDegradedException;
import com.autonomous.treasury.exception.BudgetNotFoundException;
import com.autonomous.treasury.exception.ContentionExceededException;
import com.autonomous.treasury.exception.EmergencyFreezeException;
import com.autonomous.treasury.exception.InsufficientFundsException;
import com.autonomous.treasury.exception.InvalidAmountException;
import com.autonomous.treasury.exception.OperationCancelledException;
import com.autonomous.treasury.exception.PolicyDenialException;
import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.exception.UsageLimitExceededException;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.CircuitBreakerState;
import com.autonomous.treasury.model.DenialReason;
import com.autonomous.treasury.model.RoiData;
import com.autonomous.treasury.model.Transaction;
import com.autonomous.treasury.model.TransactionOutcome;
import com.autonomous.treasury.model.TransactionReceipt;
import com.autonomous.treasury.model.TransactionType;
import com.autonomous.treasury.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns agent budgets: provisioning, spend authorization, earnings and status.
 *
 * <p>Authorization checks run in a fixed order and the first failure wins: emergency freeze,
 * amount, agent status, per-action limit, daily rollover, daily limit, balance. The debit
 * itself is a single compare-and-set on the cached budget. Every attempt, approved or not,
 * leaves exactly one {@link TransactionType#SPENDING} transaction.</p>
 */
@Slf4j
@Service
public class BudgetRegistryService {

    private final BudgetCache budgetCache;
    private final LedgerStore ledgerStore;
    private final TransactionLedgerService ledger;
    private final CircuitBreakerService circuitBreaker;
    private final AdminLogService adminLog;
    private final Clock clock;

    @Value("${treasury.defaults.seed-amount:5000}")
    private long defaultSeedAmount = 5000;

    @Value("${treasury.defaults.daily-limit:10000}")
    private long defaultDailyLimit = 10000;

    @Value("${treasury.defaults.per-action-limit:1000}")
    private long defaultPerActionLimit = 1000;

    @Value("${treasury.defaults.time-zone:UTC}")
    private String defaultTimeZone = "UTC";

    public BudgetRegistryService(BudgetCache budgetCache, LedgerStore ledgerStore, TransactionLedgerService ledger,
                                 CircuitBreakerService circuitBreaker, AdminLogService adminLog, Clock clock) {
        this.budgetCache = budgetCache;
        this.ledgerStore = ledgerStore;
        this.ledger = ledger;
        this.circuitBreaker = circuitBreaker;
        this.adminLog = adminLog;
        this.clock = clock;
    }

    public void setDefaultTimeZone(String defaultTimeZone) {
        this.defaultTimeZone = defaultTimeZone;
    }

    // Provisioning

    public AgentBudget provision(String agentId, Long seedAmount, Long dailyLimit, Long perActionLimit,
                                 String timeZone, String actor) {
        String id = requireValidAgentId(agentId);
        Optional<AgentBudget> existing = budgetCache.find(id);
        if (existing.isPresent()) {
            log.warn("Budget for {} already exists, keeping balance {}", id, existing.get().getCurrentBalance());
            return existing.get();
        }

        long seed = seedAmount != null ? seedAmount : defaultSeedAmount;
        long daily = dailyLimit != null ? dailyLimit : defaultDailyLimit;
        long perAction = perActionLimit != null ? perActionLimit : defaultPerActionLimit;
        if (seed < 0 || daily <= 0 || perAction <= 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid budget for %s: seed=%d daily=%d perAction=%d", id, seed, daily, perAction));
        }
        ZoneId zone = ZoneId.of(timeZone != null ? timeZone : defaultTimeZone);
        Instant now = clock.instant();

        AgentBudget budget = AgentBudget.builder()
            .agentId(id)
            .currentBalance(seed)
            .dailyLimit(daily)
            .perActionLimit(perAction)
            .spentToday(0)
            .lastResetDate(LocalDate.ofInstant(now, zone))
            .timeZone(zone.getId())
            .status(BudgetStatus.ACTIVE)
            .totalEarned(seed)
            .totalTransactions(seed > 0 ? 1 : 0)
            .createdAt(now)
            .updatedAt(now)
            .version(1)
            .build();

        if (!budgetCache.insert(budget)) {
            return budgetCache.find(id).orElseThrow(() -> new BudgetNotFoundException(id));
        }
        try {
            ledgerStore.upsertBudget(budget);
        } catch (StoreException e) {
            log.error("Provisioned {} but durable write failed, queued for retry", id, e);
            budgetCache.mirror(budget);
        }

        if (seed > 0) {
            recordQuietly(Transaction.builder()
                .transactionId(UUID.randomUUID().toString())
                .agentId(id)
                .type(TransactionType.SEED_FUNDING)
                .amount(seed)
                .description("Seed funding")
                .timestamp(now)
                .outcome(TransactionOutcome.SUCCESS)
                .balanceBefore(0L)
                .balanceAfter(seed)
                .build());
        }
        adminLog.record(AdminEventType.BUDGET_PROVISIONED, id, actor, "provisioned",
            String.format("seed=%d daily=%d perAction=%d zone=%s", seed, daily, perAction, zone.getId()));
        log.info("Provisioned budget for {}: seed={} daily={} perAction={}", id, seed, daily, perAction);
        return budget;
    }

    // Authorization

    /**
     * Authorizes and, if allowed, debits {@code amount} minor units.
     *
     * @return receipt for the committed debit; may carry an audit warning
     * @throws PolicyDenialException when refused; the denial is already audited
     * @throws ContentionExceededException when the debit could not be applied for contention
     * @throws OperationCancelledException when the caller was interrupted before commit
     */
    public TransactionReceipt authorize(String agentId, long amount, String description, RoiData roiData) {
        String id = normalizeAgentId(agentId);

        CircuitBreakerState breaker;
        try {
            breaker = circuitBreaker.getState();
        } catch (StoreException e) {
            throw storeUnavailable(id, amount, description, roiData, e);
        }
        if (breaker.isFrozen()) {
            throw deny(id, amount, description, roiData, null, new EmergencyFreezeException(id, breaker.getReason()));
        }
        if (amount <= 0) {
            throw deny(id, amount, description, roiData, null, new InvalidAmountException(id, amount));
        }

        BudgetUpdate<PolicyDenialException> outcome;
        try {
            outcome = budgetCache.update(id, budget -> evaluate(budget, amount));
        } catch (BudgetNotFoundException e) {
            throw deny(id, amount, description, roiData, null, e);
        } catch (ContentionExceededException e) {
            String txId = recordFailed(id, amount, description, roiData, DenialReason.CONTENTION);
            throw e.withTransactionId(txId);
        } catch (OperationCancelledException e) {
            String txId = recordFailed(id, amount, description, roiData, DenialReason.CANCELLED);
            throw e.withTransactionId(txId);
        } catch (StoreException e) {
            throw storeUnavailable(id, amount, description, roiData, e);
        }

        AgentBudget budget = outcome.getBudget();
        if (outcome.getResult() != null) {
            throw deny(id, amount, description, roiData, budget, outcome.getResult());
        }

        Transaction transaction = Transaction.builder()
            .transactionId(UUID.randomUUID().toString())
            .agentId(id)
            .type(TransactionType.SPENDING)
            .amount(-amount)
            .description(description)
            .timestamp(clock.instant())
            .outcome(TransactionOutcome.SUCCESS)
            .balanceBefore(budget.getCurrentBalance() + amount)
            .balanceAfter(budget.getCurrentBalance())
            .roiData(roiData)
            .build();
        AuditWriteDegradedException warning = recordCommitted(transaction);

        log.debug("Authorized {} for {} ({}), balance now {}", amount, id, description, budget.getCurrentBalance());
        return TransactionReceipt.builder()
            .transactionId(transaction.getTransactionId())
            .agentId(id)
            .balanceAfter(budget.getCurrentBalance())
            .spentToday(budget.getSpentToday())
            .auditWarning(warning)
            .build();
    }

    private BudgetUpdate<PolicyDenialException> evaluate(AgentBudget budget, long amount) {
        String id = budget.getAgentId();
        if (!budget.isActive()) {
            return BudgetUpdate.skip(budget, new AgentInactiveException(id, budget.getStatus()));
        }
        if (amount > budget.getPerActionLimit()) {
            return BudgetUpdate.skip(budget,
                new UsageLimitExceededException(id, DenialReason.PER_ACTION, amount, budget.getPerActionLimit()));
        }

        boolean rolledOver = rollover(budget);

        if (budget.getSpentToday() + amount > budget.getDailyLimit()) {
            return denyAfterRollover(budget, rolledOver,
                new UsageLimitExceededException(id, DenialReason.DAILY, amount, budget.availableDailyBudget()));
        }
        if (budget.getCurrentBalance() < amount) {
            return denyAfterRollover(budget, rolledOver,
                new InsufficientFundsException(id, amount, budget.getCurrentBalance()));
        }

        budget.setCurrentBalance(budget.getCurrentBalance() - amount);
        budget.setSpentToday(budget.getSpentToday() + amount);
        budget.setTotalSpent(budget.getTotalSpent() + amount);
        budget.setTotalTransactions(budget.getTotalTransactions() + 1);
        return BudgetUpdate.commit(budget, null);
    }

    // a denial still keeps the rollover it triggered
    private static BudgetUpdate<PolicyDenialException> denyAfterRollover(AgentBudget budget, boolean rolledOver,
                                                                         PolicyDenialException denial) {
        return rolledOver ? BudgetUpdate.commit(budget, denial) : BudgetUpdate.skip(budget, denial);
    }

    // Earnings

    /**
     * Credits realized value back to the agent. Allowed while frozen; freezing only stops spend.
     */
    public TransactionReceipt recordEarning(String agentId, long amount, String description, RoiData roiData) {
        String id = normalizeAgentId(agentId);
        if (amount <= 0) {
            throw new IllegalArgumentException("Earning amount must be positive, got " + amount);
        }
        BudgetUpdate<Void> outcome = budgetCache.update(id, budget -> {
            if (budget.getStatus() == BudgetStatus.DECOMMISSIONED) {
                throw new IllegalStateException("Agent '" + id + "' is decommissioned");
            }
            budget.setCurrentBalance(budget.getCurrentBalance() + amount);
            budget.setTotalEarned(budget.getTotalEarned() + amount);
            budget.setTotalTransactions(budget.getTotalTransactions() + 1);
            return BudgetUpdate.commit(budget, null);
        });
        AgentBudget budget = outcome.getBudget();

        Transaction transaction = Transaction.builder()
            .transactionId(UUID.randomUUID().toString())
            .agentId(id)
            .type(TransactionType.EARNING)
            .amount(amount)
            .description(description)
            .timestamp(clock.instant())
            .outcome(TransactionOutcome.SUCCESS)
            .balanceBefore(budget.getCurrentBalance() - amount)
            .balanceAfter(budget.getCurrentBalance())
            .roiData(roiData)
            .build();
        AuditWriteDegradedException warning = recordCommitted(transaction);

        log.info("Credited {} to {} ({}), balance now {}", amount, id, description, budget.getCurrentBalance());
        return TransactionReceipt.builder()
            .transactionId(transaction.getTransactionId())
            .agentId(id)
            .balanceAfter(budget.getCurrentBalance())
            .spentToday(budget.getSpentToday())
            .auditWarning(warning)
            .build();
    }

    // Status and reads

    public AgentBudget setStatus(String agentId, BudgetStatus status, String actor, String reason) {
        String id = normalizeAgentId(agentId);
        BudgetUpdate<BudgetStatus> outcome = budgetCache.update(id, budget -> {
            BudgetStatus previous = budget.getStatus();
            if (previous == status) {
                return BudgetUpdate.skip(budget, previous);
            }
            if (previous == BudgetStatus.DECOMMISSIONED) {
                throw new IllegalStateException("Agent '" + id + "' is decommissioned");
            }
            budget.setStatus(status);
            return BudgetUpdate.commit(budget, previous);
        });
        if (outcome.isCommitted()) {
            adminLog.record(AdminEventType.STATUS_CHANGED, id, actor, reason,
                outcome.getResult() + " -> " + status);
            log.info("Agent {} status {} -> {} by {}: {}", id, outcome.getResult(), status, actor, reason);
        }
        return outcome.getBudget();
    }

    public AgentBudget getBudget(String agentId) {
        String id = normalizeAgentId(agentId);
        return budgetCache.find(id).orElseThrow(() -> new BudgetNotFoundException(id));
    }

    public List<AgentBudget> listBudgets() {
        List<AgentBudget> budgets = new ArrayList<>();
        for (String id : ledgerStore.findAllBudgetIds()) {
            budgetCache.find(id).ifPresent(budgets::add);
        }
        return budgets;
    }

    /**
     * Resets {@code spentToday} if the agent's local date has moved past {@code lastResetDate}.
     *
     * @return whether a rollover was committed
     */
    public boolean rolloverIfDue(String agentId) {
        BudgetUpdate<Boolean> outcome = budgetCache.update(normalizeAgentId(agentId), budget ->
            rollover(budget) ? BudgetUpdate.commit(budget, true) : BudgetUpdate.skip(budget, false));
        return outcome.isCommitted();
    }

    public static String normalizeAgentId(String agentId) {
        return agentId == null ? "" : agentId.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static String requireValidAgentId(String agentId) {
        String id = normalizeAgentId(agentId);
        if (id.length() < 3) {
            throw new IllegalArgumentException("agent_id must be at least 3 characters long");
        }
        return id;
    }

    private boolean rollover(AgentBudget budget) {
        ZoneId zone = ZoneId.of(budget.getTimeZone() != null ? budget.getTimeZone() : defaultTimeZone);
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        if (today.equals(budget.getLastResetDate())) {
            return false;
        }
        budget.setSpentToday(0);
        budget.setLastResetDate(today);
        return true;
    }

    // Audit helpers

    private PolicyDenialException deny(String agentId, long amount, String description, RoiData roiData,
                                       AgentBudget budget, PolicyDenialException denial) {
        String txId = recordFailed(agentId, amount, description, roiData, denial.getReason(),
            budget != null ? budget.getCurrentBalance() : null);
        log.info("Denied {} for {} ({}): {}", amount, agentId, description, denial.getReason().code());
        return denial.withTransactionId(txId);
    }

    private StoreException storeUnavailable(String agentId, long amount, String description, RoiData roiData,
                                            StoreException cause) {
        log.error("Store unavailable while authorizing {} for {}: {}", amount, agentId, cause.getMessage());
        return cause.withTransactionId(recordFailed(agentId, amount, description, roiData,
            DenialReason.STORE_UNAVAILABLE));
    }

    private String recordFailed(String agentId, long amount, String description, RoiData roiData,
                                DenialReason reason) {
        return recordFailed(agentId, amount, description, roiData, reason, null);
    }

    private String recordFailed(String agentId, long amount, String description, RoiData roiData,
                                DenialReason reason, Long balance) {
        Transaction transaction = Transaction.builder()
            .transactionId(UUID.randomUUID().toString())
            .agentId(agentId)
            .type(TransactionType.SPENDING)
            .amount(-amount)
            .description(description)
            .timestamp(clock.instant())
            .outcome(TransactionOutcome.DENIED)
            .denialReason(reason)
            .balanceBefore(balance)
            .balanceAfter(balance)
            .roiData(roiData)
            .build();
        recordQuietly(transaction);
        return transaction.getTransactionId();
    }

    /**
     * Records a transaction for a change that already committed. A pending interrupt is held
     * back for the duration so the audit write cannot be abandoned halfway.
     */
    private AuditWriteDegradedException recordCommitted(Transaction transaction) {
        boolean interrupted = Thread.interrupted();
        try {
            ledger.record(transaction);
            return null;
        } catch (AuditWriteDegradedException e) {
            return e;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void recordQuietly(Transaction transaction) {
        AuditWriteDegradedException warning = recordCommitted(transaction);
        if (warning != null) {
            log.warn("Transaction {} buffered: {}", transaction.getTransactionId(), warning.getMessage());
        }
    }
}

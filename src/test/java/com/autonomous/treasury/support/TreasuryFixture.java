package com.autonomous.treasury.support;

import com.autonomous.treasury.service.AdminLogService;
import com.autonomous.treasury.service.BudgetCache;
import com.autonomous.treasury.service.BudgetRegistryService;
import com.autonomous.treasury.service.CasRetryTemplate;
import com.autonomous.treasury.service.CircuitBreakerService;
import com.autonomous.treasury.service.DurableWriteQueue;
import com.autonomous.treasury.service.OpsAlertService;
import com.autonomous.treasury.service.PerformanceScalerService;
import com.autonomous.treasury.service.TransactionLedgerService;
import com.autonomous.treasury.store.InMemoryCacheStore;
import com.autonomous.treasury.store.LedgerStore;

import java.time.Instant;

/**
 * Wires the treasury services by hand over an in-memory cache and the given ledger store.
 */
public class TreasuryFixture {

    public static final Instant START = Instant.parse("2024-03-10T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryCacheStore cacheStore = new InMemoryCacheStore(clock);
    public final LedgerStore ledgerStore;
    public final OpsAlertService opsAlert = new OpsAlertService();
    public final DurableWriteQueue writeQueue = new DurableWriteQueue(clock, opsAlert);
    public final CasRetryTemplate casRetry = new CasRetryTemplate(cacheStore);
    public final AdminLogService adminLog;
    public final TransactionLedgerService ledger;
    public final CircuitBreakerService circuitBreaker;
    public final BudgetCache budgetCache;
    public final BudgetRegistryService registry;
    public final PerformanceScalerService scaler;

    public TreasuryFixture(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
        this.adminLog = new AdminLogService(ledgerStore, writeQueue, clock);
        this.ledger = new TransactionLedgerService(ledgerStore, cacheStore, writeQueue, opsAlert);
        this.ledger.setBackoffMs(1);
        this.circuitBreaker = new CircuitBreakerService(cacheStore, adminLog, opsAlert, clock);
        this.budgetCache = new BudgetCache(cacheStore, ledgerStore, casRetry, writeQueue, clock);
        this.registry = new BudgetRegistryService(budgetCache, ledgerStore, ledger, circuitBreaker, adminLog, clock);
        this.scaler = new PerformanceScalerService(budgetCache, registry, ledger, adminLog, clock);
    }

    public void close() {
        writeQueue.shutdown();
        opsAlert.shutdown();
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.exception.TreasuryException;
import com.autonomous.treasury.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Proactively rolls over {@code spentToday} for agents that have not spent since their
 * local midnight. Authorization rolls over lazily on its own; this only keeps reads fresh.
 */
@Slf4j
@Service
public class DailyResetScheduler {

    private final BudgetRegistryService registry;
    private final LedgerStore ledgerStore;

    public DailyResetScheduler(BudgetRegistryService registry, LedgerStore ledgerStore) {
        this.registry = registry;
        this.ledgerStore = ledgerStore;
    }

    @Scheduled(fixedDelayString = "${treasury.reset.interval-ms:900000}")
    public void scheduledSweep() {
        sweep();
    }

    public int sweep() {
        int rolled = 0;
        for (String agentId : ledgerStore.findAllBudgetIds()) {
            try {
                if (registry.rolloverIfDue(agentId)) {
                    rolled++;
                }
            } catch (TreasuryException e) {
                log.warn("Daily rollover of {} failed: {}", agentId, e.getMessage());
            }
        }
        if (rolled > 0) {
            log.info("Daily rollover applied to {} agents", rolled);
        }
        return rolled;
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.config.TreasuryJson;
import com.autonomous.treasury.exception.BudgetNotFoundException;
import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.store.CacheStore;
import com.autonomous.treasury.store.LedgerStore;
import com.autonomous.treasury.store.Versioned;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed access to {@code budget:{agentId}} entries. The cache copy is authoritative; a missing
 * entry is rehydrated from the durable ledger. Every committed change is mirrored to the
 * durable store in the background.
 */
@Slf4j
@Component
public class BudgetCache {

    private final CacheStore cacheStore;
    private final LedgerStore ledgerStore;
    private final CasRetryTemplate casRetry;
    private final DurableWriteQueue writeQueue;
    private final Clock clock;
    private final ObjectMapper mapper = TreasuryJson.mapper();

    public BudgetCache(CacheStore cacheStore, LedgerStore ledgerStore, CasRetryTemplate casRetry,
                       DurableWriteQueue writeQueue, Clock clock) {
        this.cacheStore = cacheStore;
        this.ledgerStore = ledgerStore;
        this.casRetry = casRetry;
        this.writeQueue = writeQueue;
        this.clock = clock;
    }

    public static String key(String agentId) {
        return "budget:" + agentId;
    }

    public Optional<AgentBudget> find(String agentId) {
        Optional<Versioned<String>> cached = cacheStore.get(key(agentId));
        if (cached.isPresent()) {
            return Optional.of(decode(cached.get().getValue()));
        }
        return hydrate(agentId);
    }

    /**
     * Inserts a brand-new budget. Returns false if one already exists in the cache.
     */
    public boolean insert(AgentBudget budget) {
        return cacheStore.compareAndSet(key(budget.getAgentId()), 0, encode(budget), null);
    }

    /**
     * Applies {@code mutation} under compare-and-set. The mutation may run more than once and
     * must be free of side effects. {@code version} and {@code updatedAt} are stamped here.
     *
     * @throws BudgetNotFoundException if the agent has no budget anywhere
     */
    public <R> BudgetUpdate<R> update(String agentId, Function<AgentBudget, BudgetUpdate<R>> mutation) {
        if (find(agentId).isEmpty()) {
            throw new BudgetNotFoundException(agentId);
        }
        BudgetUpdate<R> outcome = casRetry.execute(key(agentId), null, current -> {
            if (current == null) {
                throw new BudgetNotFoundException(agentId);
            }
            AgentBudget read = decode(current.getValue());
            BudgetUpdate<R> update = mutation.apply(read.toBuilder().build());
            if (!update.isCommitted()) {
                return CasStep.skip(BudgetUpdate.skip(read, update.getResult()));
            }
            AgentBudget next = update.getBudget().toBuilder()
                .version(read.getVersion() + 1)
                .updatedAt(clock.instant())
                .build();
            return CasStep.write(encode(next), BudgetUpdate.commit(next, update.getResult()));
        });
        if (outcome.isCommitted()) {
            mirror(outcome.getBudget());
        }
        return outcome;
    }

    /**
     * Queues the snapshot for the durable store; latest snapshot per agent wins.
     */
    public void mirror(AgentBudget snapshot) {
        writeQueue.submit("budget:" + snapshot.getAgentId(), () -> ledgerStore.upsertBudget(snapshot));
    }

    private Optional<AgentBudget> hydrate(String agentId) {
        Optional<AgentBudget> durable = ledgerStore.findBudget(agentId);
        if (durable.isEmpty()) {
            return Optional.empty();
        }
        if (cacheStore.compareAndSet(key(agentId), 0, encode(durable.get()), null)) {
            log.info("Rehydrated budget for {} from durable store (v{})", agentId, durable.get().getVersion());
            return durable;
        }
        // someone else got there first
        return cacheStore.get(key(agentId)).map(v -> decode(v.getValue()));
    }

    private String encode(AgentBudget budget) {
        try {
            return mapper.writeValueAsString(budget);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode budget " + budget.getAgentId(), e);
        }
    }

    private AgentBudget decode(String json) {
        try {
            return mapper.readValue(json, AgentBudget.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt budget entry", e);
        }
    }
}

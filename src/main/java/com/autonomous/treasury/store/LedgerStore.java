package com.autonomous.treasury.store;

import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.Transaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record store: the authority for audit completeness. Every method may throw
 * {@link com.autonomous.treasury.exception.StoreException}.
 */
public interface LedgerStore {

    /**
     * Appends a transaction. Appending the same transaction id twice must not produce two
     * records on read.
     */
    void appendTransaction(Transaction transaction);

    /**
     * Inserts or replaces a budget snapshot. A snapshot older than the stored one
     * (lower {@code version}) is ignored.
     */
    void upsertBudget(AgentBudget budget);

    Optional<AgentBudget> findBudget(String agentId);

    List<String> findAllBudgetIds();

    /**
     * Transactions for one agent with {@code from <= timestamp < to}, oldest first.
     */
    List<Transaction> findTransactions(String agentId, Instant from, Instant to);

    void appendAdminEvent(AdminEvent event);

    List<AdminEvent> findAdminEvents(Instant from, Instant to);
}

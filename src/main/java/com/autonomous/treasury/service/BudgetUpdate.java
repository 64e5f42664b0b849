package com.autonomous.treasury.service;

import com.autonomous.treasury.model.AgentBudget;

/**
 * Outcome of a budget mutation: either a new snapshot to commit or the unchanged one, plus
 * whatever the caller wants back.
 */
public final class BudgetUpdate<R> {

    private final AgentBudget budget;
    private final boolean commit;
    private final R result;

    private BudgetUpdate(AgentBudget budget, boolean commit, R result) {
        this.budget = budget;
        this.commit = commit;
        this.result = result;
    }

    public static <R> BudgetUpdate<R> commit(AgentBudget next, R result) {
        return new BudgetUpdate<>(next, true, result);
    }

    public static <R> BudgetUpdate<R> skip(AgentBudget current, R result) {
        return new BudgetUpdate<>(current, false, result);
    }

    /**
     * The committed snapshot, or the one that was read when skipped.
     */
    public AgentBudget getBudget() {
        return budget;
    }

    public boolean isCommitted() {
        return commit;
    }

    public R getResult() {
        return result;
    }
}

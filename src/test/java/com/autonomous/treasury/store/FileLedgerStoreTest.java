package com.autonomous.treasury.store;

import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.DenialReason;
import com.autonomous.treasury.model.Transaction;
import com.autonomous.treasury.model.TransactionOutcome;
import com.autonomous.treasury.model.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileLedgerStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private FileLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new FileLedgerStore(tempDir);
    }

    @Test
    void shouldAppendAndReadTransactionsInRange() {
        store.appendTransaction(tx("t1", "agent_a", T0));
        store.appendTransaction(tx("t2", "agent_a", T0.plusSeconds(60)));
        store.appendTransaction(tx("t3", "agent_b", T0.plusSeconds(30)));

        List<Transaction> all = store.findTransactions("agent_a", null, null);
        assertEquals(2, all.size());
        assertEquals("t1", all.get(0).getTransactionId());

        List<Transaction> windowed = store.findTransactions("agent_a", T0.plusSeconds(1), T0.plusSeconds(61));
        assertEquals(1, windowed.size());
        assertEquals("t2", windowed.get(0).getTransactionId());
    }

    @Test
    void shouldPreserveDenialDetails() {
        Transaction denied = Transaction.builder()
            .transactionId("d1")
            .agentId("agent_a")
            .type(TransactionType.SPENDING)
            .amount(-2500)
            .description("big call")
            .timestamp(T0)
            .outcome(TransactionOutcome.DENIED)
            .denialReason(DenialReason.PER_ACTION)
            .build();
        store.appendTransaction(denied);

        Transaction read = store.findTransactions("agent_a", null, null).get(0);
        assertEquals(DenialReason.PER_ACTION, read.getDenialReason());
        assertEquals(TransactionOutcome.DENIED, read.getOutcome());
        assertEquals("treasury", read.getProcessedBy());
        assertFalse(read.isSuccessful());
    }

    @Test
    void shouldNotDuplicateTransactionAppendedTwice() {
        Transaction t = tx("t1", "agent_a", T0);
        store.appendTransaction(t);
        store.appendTransaction(t);

        assertEquals(1, store.findTransactions("agent_a", null, null).size());
    }

    @Test
    void shouldSkipTornLines() throws Exception {
        store.appendTransaction(tx("t1", "agent_a", T0));
        Files.writeString(tempDir.resolve("transactions.jsonl"), "{\"transaction_id\":\"t2\",\"age",
            StandardOpenOption.APPEND);

        assertEquals(1, store.findTransactions("agent_a", null, null).size());
    }

    @Test
    void shouldIgnoreOlderBudgetSnapshot() {
        store.upsertBudget(budget("agent_a", 7000, 3));
        store.upsertBudget(budget("agent_a", 9000, 2));

        AgentBudget stored = store.findBudget("agent_a").orElseThrow();
        assertEquals(7000, stored.getCurrentBalance());
        assertEquals(3, stored.getVersion());
        assertEquals(LocalDate.of(2024, 3, 10), stored.getLastResetDate());
    }

    @Test
    void shouldListBudgetIds() {
        store.upsertBudget(budget("zeta", 1, 1));
        store.upsertBudget(budget("alpha", 1, 1));

        assertEquals(List.of("alpha", "zeta"), store.findAllBudgetIds());
        assertTrue(store.findBudget("missing").isEmpty());
    }

    @Test
    void shouldStoreAdminEvents() {
        store.appendAdminEvent(AdminEvent.builder()
            .eventId("e1").type(AdminEventType.FREEZE).actor("ops").reason("incident").timestamp(T0).build());
        store.appendAdminEvent(AdminEvent.builder()
            .eventId("e2").type(AdminEventType.UNFREEZE).actor("ops").reason("resolved")
            .timestamp(T0.plusSeconds(10)).build());

        List<AdminEvent> events = store.findAdminEvents(null, null);
        assertEquals(2, events.size());
        assertEquals(AdminEventType.UNFREEZE, events.get(1).getType());
        assertEquals(1, store.findAdminEvents(T0.plusSeconds(5), null).size());
    }

    private static Transaction tx(String id, String agentId, Instant at) {
        return Transaction.builder()
            .transactionId(id)
            .agentId(agentId)
            .type(TransactionType.SPENDING)
            .amount(-100)
            .description("call")
            .timestamp(at)
            .outcome(TransactionOutcome.SUCCESS)
            .balanceBefore(1000L)
            .balanceAfter(900L)
            .build();
    }

    private static AgentBudget budget(String agentId, long balance, long version) {
        return AgentBudget.builder()
            .agentId(agentId)
            .currentBalance(balance)
            .dailyLimit(5000)
            .perActionLimit(2000)
            .lastResetDate(LocalDate.of(2024, 3, 10))
            .timeZone("UTC")
            .createdAt(T0)
            .updatedAt(T0)
            .version(version)
            .build();
    }
}

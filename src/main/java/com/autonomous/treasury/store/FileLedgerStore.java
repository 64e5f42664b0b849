package com.autonomous.treasury.store;

import com.autonomous.treasury.config.TreasuryJson;
import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.Transaction;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LedgerStore} on the local filesystem: append-only JSON-lines files for transactions
 * and admin events, one JSON document per budget.
 *
 * <pre>
 * {root}/transactions.jsonl
 * {root}/admin-events.jsonl
 * {root}/budgets/{agentId}.json
 * </pre>
 */
@Slf4j
public class FileLedgerStore implements LedgerStore {

    private final Path transactionsFile;
    private final Path adminEventsFile;
    private final Path budgetsDir;
    private final ObjectMapper mapper = TreasuryJson.mapper();

    private final Object appendLock = new Object();
    private final Object budgetLock = new Object();

    public FileLedgerStore(Path root) {
        this.transactionsFile = root.resolve("transactions.jsonl");
        this.adminEventsFile = root.resolve("admin-events.jsonl");
        this.budgetsDir = root.resolve("budgets");
    }

    @Override
    public void appendTransaction(Transaction transaction) {
        appendLine(transactionsFile, transaction);
    }

    @Override
    public void appendAdminEvent(AdminEvent event) {
        appendLine(adminEventsFile, event);
    }

    @Override
    public void upsertBudget(AgentBudget budget) {
        Path target = budgetsDir.resolve(budget.getAgentId() + ".json");
        synchronized (budgetLock) {
            try {
                Files.createDirectories(budgetsDir);
                Optional<AgentBudget> stored = readBudget(target);
                if (stored.isPresent() && stored.get().getVersion() > budget.getVersion()) {
                    log.debug("Ignoring stale snapshot for {} (v{} < v{})",
                        budget.getAgentId(), budget.getVersion(), stored.get().getVersion());
                    return;
                }
                Path temp = budgetsDir.resolve(budget.getAgentId() + ".json.tmp");
                Files.writeString(temp, mapper.writeValueAsString(budget));
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StoreException("Failed to persist budget " + budget.getAgentId(), e);
            }
        }
    }

    @Override
    public Optional<AgentBudget> findBudget(String agentId) {
        try {
            return readBudget(budgetsDir.resolve(agentId + ".json"));
        } catch (IOException e) {
            throw new StoreException("Failed to read budget " + agentId, e);
        }
    }

    @Override
    public List<String> findAllBudgetIds() {
        if (!Files.isDirectory(budgetsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(budgetsDir)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(".json"))
                .map(name -> name.substring(0, name.length() - ".json".length()))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("Failed to list budgets under " + budgetsDir, e);
        }
    }

    @Override
    public List<Transaction> findTransactions(String agentId, Instant from, Instant to) {
        Map<String, Transaction> unique = new LinkedHashMap<>();
        for (Transaction tx : readLines(transactionsFile, Transaction.class)) {
            if (agentId.equals(tx.getAgentId()) && inRange(tx.getTimestamp(), from, to)) {
                unique.putIfAbsent(tx.getTransactionId(), tx);
            }
        }
        List<Transaction> result = new ArrayList<>(unique.values());
        result.sort(Comparator.comparing(Transaction::getTimestamp));
        return result;
    }

    @Override
    public List<AdminEvent> findAdminEvents(Instant from, Instant to) {
        Map<String, AdminEvent> unique = new LinkedHashMap<>();
        for (AdminEvent event : readLines(adminEventsFile, AdminEvent.class)) {
            if (inRange(event.getTimestamp(), from, to)) {
                unique.putIfAbsent(event.getEventId(), event);
            }
        }
        List<AdminEvent> result = new ArrayList<>(unique.values());
        result.sort(Comparator.comparing(AdminEvent::getTimestamp));
        return result;
    }

    private void appendLine(Path file, Object record) {
        synchronized (appendLock) {
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, mapper.writeValueAsString(record) + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new StoreException("Failed to append to " + file.getFileName(), e);
            }
        }
    }

    private <T> List<T> readLines(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<T> records = new ArrayList<>();
        try (Stream<String> lines = Files.lines(file)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    records.add(mapper.readValue(line, type));
                } catch (IOException e) {
                    // a torn trailing line from a crash mid-append
                    log.warn("Skipping malformed line in {}: {}", file.getFileName(), e.getMessage());
                }
            });
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file.getFileName(), e);
        }
        return records;
    }

    private Optional<AgentBudget> readBudget(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), AgentBudget.class));
    }

    private static boolean inRange(Instant timestamp, Instant from, Instant to) {
        return timestamp != null
            && (from == null || !timestamp.isBefore(from))
            && (to == null || timestamp.isBefore(to));
    }
}

package com.autonomous.treasury.service;

import com.autonomous.treasury.config.TreasuryJson;
import com.autonomous.treasury.exception.AuditWriteDegradedException;
import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.model.Transaction;
import com.autonomous.treasury.store.CacheStore;
import com.autonomous.treasury.store.LedgerStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only audit trail. Each transaction goes to the durable ledger and to a bounded
 * recent-activity list in the cache.
 *
 * <p>When the durable store will not take a write, the transaction is buffered in
 * {@link DurableWriteQueue} and {@link AuditWriteDegradedException} is thrown. Buffered
 * transactions stay visible to {@link #getTransactions} until they land.</p>
 */
@Slf4j
@Service
public class TransactionLedgerService {

    static final String DEGRADED_COUNTER_KEY = "treasury:audit:degraded";

    private final LedgerStore ledgerStore;
    private final CacheStore cacheStore;
    private final DurableWriteQueue writeQueue;
    private final OpsAlertService opsAlert;
    private final ObjectMapper mapper = TreasuryJson.mapper();
    private final Map<String, Transaction> buffered = new ConcurrentHashMap<>();

    @Value("${treasury.audit.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${treasury.audit.backoff-ms:20}")
    private long backoffMs = 20;

    @Value("${treasury.recent.max-entries:1000}")
    private int recentMaxEntries = 1000;

    @Value("${treasury.recent.ttl-days:30}")
    private int recentTtlDays = 30;

    public TransactionLedgerService(LedgerStore ledgerStore, CacheStore cacheStore,
                                    DurableWriteQueue writeQueue, OpsAlertService opsAlert) {
        this.ledgerStore = ledgerStore;
        this.cacheStore = cacheStore;
        this.writeQueue = writeQueue;
        this.opsAlert = opsAlert;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public void setRecentMaxEntries(int recentMaxEntries) {
        this.recentMaxEntries = recentMaxEntries;
    }

    /**
     * @throws AuditWriteDegradedException if the durable append did not succeed; the
     *         transaction is buffered and will be retried until it does
     */
    public void record(Transaction transaction) {
        indexRecent(transaction);

        StoreException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ledgerStore.appendTransaction(transaction);
                return;
            } catch (StoreException e) {
                lastFailure = e;
                log.warn("Durable append of {} failed (attempt {}/{}): {}",
                    transaction.getTransactionId(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !pause(backoffMs << (attempt - 1))) {
                    break;
                }
            }
        }

        buffer(transaction);
        long degraded = cacheStore.increment(DEGRADED_COUNTER_KEY, null);
        log.error("Audit write degraded for transaction {} (agent {}); {} degraded writes so far",
            transaction.getTransactionId(), transaction.getAgentId(), degraded, lastFailure);
        opsAlert.alert(String.format("Audit write degraded for transaction %s (agent %s): %s",
            transaction.getTransactionId(), transaction.getAgentId(),
            lastFailure != null ? lastFailure.getMessage() : "interrupted"));
        throw new AuditWriteDegradedException(transaction.getTransactionId(), lastFailure);
    }

    /**
     * Durable history merged with anything still buffered, oldest first.
     */
    public List<Transaction> getTransactions(String agentId, Instant from, Instant to) {
        Map<String, Transaction> merged = new LinkedHashMap<>();
        for (Transaction tx : ledgerStore.findTransactions(agentId, from, to)) {
            merged.put(tx.getTransactionId(), tx);
        }
        for (Transaction tx : buffered.values()) {
            if (agentId.equals(tx.getAgentId())
                && (from == null || !tx.getTimestamp().isBefore(from))
                && (to == null || tx.getTimestamp().isBefore(to))) {
                merged.putIfAbsent(tx.getTransactionId(), tx);
            }
        }
        List<Transaction> result = new ArrayList<>(merged.values());
        result.sort(Comparator.comparing(Transaction::getTimestamp));
        return result;
    }

    /**
     * Newest first, straight from the cache index.
     */
    public List<Transaction> getRecentTransactions(String agentId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<Transaction> result = new ArrayList<>();
        for (String json : cacheStore.recent(recentKey(agentId), limit)) {
            try {
                result.add(mapper.readValue(json, Transaction.class));
            } catch (IOException e) {
                log.warn("Skipping unreadable recent transaction for {}: {}", agentId, e.getMessage());
            }
        }
        return result;
    }

    public int bufferedCount() {
        return buffered.size();
    }

    public long degradedWriteCount() {
        return cacheStore.get(DEGRADED_COUNTER_KEY)
            .map(v -> Long.parseLong(v.getValue()))
            .orElse(0L);
    }

    static String recentKey(String agentId) {
        return "transactions:" + agentId;
    }

    private void buffer(Transaction transaction) {
        buffered.put(transaction.getTransactionId(), transaction);
        writeQueue.enqueue("transaction:" + transaction.getTransactionId(), () -> {
            ledgerStore.appendTransaction(transaction);
            buffered.remove(transaction.getTransactionId());
        });
    }

    private void indexRecent(Transaction transaction) {
        try {
            cacheStore.pushRecent(recentKey(transaction.getAgentId()), mapper.writeValueAsString(transaction),
                recentMaxEntries, Duration.ofDays(recentTtlDays));
        } catch (JsonProcessingException | StoreException e) {
            // the index is a convenience; the durable ledger is the record
            log.warn("Could not index transaction {} as recent activity: {}",
                transaction.getTransactionId(), e.getMessage());
        }
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

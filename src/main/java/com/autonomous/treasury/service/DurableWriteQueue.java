package com.autonomous.treasury.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Local buffer for writes to the durable store that must eventually land. Writes are keyed;
 * a newer write for the same key replaces a pending older one. Failed writes are retried by
 * {@link #drain()} with exponential backoff per key, forever.
 */
@Slf4j
@Component
public class DurableWriteQueue {

    private static final Duration MAX_BACKOFF = Duration.ofMinutes(1);

    /**
     * A single durable write. Throws on failure.
     */
    @FunctionalInterface
    public interface DurableWrite {
        void write();
    }

    private final Clock clock;
    private final OpsAlertService opsAlert;
    private final Map<String, PendingWrite> pending = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @Value("${treasury.audit.retry-interval-ms:1000}")
    private long baseBackoffMs = 1000;

    @Value("${treasury.audit.alert-after-attempts:5}")
    private int alertAfterAttempts = 5;

    public DurableWriteQueue(Clock clock, OpsAlertService opsAlert) {
        this.clock = clock;
        this.opsAlert = opsAlert;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
        this.baseBackoffMs = baseBackoffMs;
    }

    /**
     * Attempts the write off the caller's thread; on failure it stays buffered.
     */
    public CompletableFuture<Void> submit(String key, DurableWrite write) {
        PendingWrite entry = new PendingWrite(key, write, clock.instant());
        pending.put(key, entry);
        return CompletableFuture.runAsync(() -> attempt(entry), executor);
    }

    /**
     * Buffers a write that already failed on the caller's thread.
     */
    public void enqueue(String key, DurableWrite write) {
        PendingWrite entry = new PendingWrite(key, write, clock.instant());
        entry.attempts = 1;
        entry.nextAttemptAt = clock.instant().plus(backoff(1));
        pending.put(key, entry);
    }

    @Scheduled(fixedDelayString = "${treasury.audit.retry-interval-ms:1000}")
    public void drain() {
        Instant now = clock.instant();
        List<PendingWrite> due = new ArrayList<>();
        for (PendingWrite entry : pending.values()) {
            if (!entry.nextAttemptAt.isAfter(now)) {
                due.add(entry);
            }
        }
        due.forEach(this::attempt);
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        new ArrayList<>(pending.values()).forEach(this::attempt);
        if (!pending.isEmpty()) {
            log.error("Shutting down with {} durable writes still pending: {}", pending.size(), pending.keySet());
        }
    }

    private void attempt(PendingWrite entry) {
        synchronized (entry) {
            if (pending.get(entry.key) != entry) {
                return; // superseded or already written
            }
            try {
                entry.write.write();
                pending.remove(entry.key, entry);
                if (entry.attempts > 0) {
                    log.info("Durable write {} succeeded after {} failed attempts", entry.key, entry.attempts);
                }
            } catch (RuntimeException e) {
                entry.attempts++;
                entry.nextAttemptAt = clock.instant().plus(backoff(entry.attempts));
                log.warn("Durable write {} failed (attempt {}): {}", entry.key, entry.attempts, e.getMessage());
                if (entry.attempts == alertAfterAttempts) {
                    log.error("Durable write {} still failing after {} attempts", entry.key, entry.attempts, e);
                    opsAlert.alert(String.format("Durable write %s failing after %d attempts: %s",
                        entry.key, entry.attempts, e.getMessage()));
                }
            }
        }
    }

    private Duration backoff(int attempts) {
        long millis = baseBackoffMs << Math.min(attempts - 1, 16);
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    private static final class PendingWrite {
        final String key;
        final DurableWrite write;
        int attempts;
        Instant nextAttemptAt;

        PendingWrite(String key, DurableWrite write, Instant now) {
            this.key = key;
            this.write = write;
            this.nextAttemptAt = now;
        }
    }
}

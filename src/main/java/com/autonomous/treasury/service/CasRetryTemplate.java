package com.autonomous.treasury.service;

import com.autonomous.treasury.exception.ContentionExceededException;
import com.autonomous.treasury.exception.OperationCancelledException;
import com.autonomous.treasury.store.CacheStore;
import com.autonomous.treasury.store.Versioned;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Read, compute, write-if-unchanged, retry. The one place optimistic updates against the
 * cache store are retried; the budget registry, the scaler and the reset sweep all go
 * through here.
 *
 * <p>The operation may run several times and must not have side effects. An interrupt seen
 * before the write lands aborts with {@link OperationCancelledException}; nothing is written.</p>
 */
@Slf4j
@Component
public class CasRetryTemplate {

    private final CacheStore cacheStore;

    @Value("${treasury.cas.max-attempts:10}")
    private int maxAttempts = 10;

    @Value("${treasury.cas.base-backoff-ms:2}")
    private long baseBackoffMs = 2;

    public CasRetryTemplate(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
        this.baseBackoffMs = baseBackoffMs;
    }

    /**
     * @param operation receives the current value, or {@code null} when the key is absent
     */
    public <T> T execute(String key, Duration ttl, Function<Versioned<String>, CasStep<T>> operation) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException(key);
            }
            Versioned<String> current = cacheStore.get(key).orElse(null);
            CasStep<T> step = operation.apply(current);
            if (!step.isWrite()) {
                return step.getResult();
            }
            long expected = current == null ? 0 : current.getVersion();
            if (Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException(key);
            }
            if (cacheStore.compareAndSet(key, expected, step.getNewValue(), ttl)) {
                if (attempt > 0) {
                    log.debug("CAS on {} committed after {} retries", key, attempt);
                }
                return step.getResult();
            }
            backoff(key, attempt);
        }
        log.warn("CAS on {} exhausted {} attempts", key, maxAttempts);
        throw new ContentionExceededException(key, maxAttempts);
    }

    /**
     * Equal-jitter exponential delay: half deterministic, half random, doubling per attempt.
     */
    Duration backoffFor(int attempt) {
        long upper = Math.max(1L, baseBackoffMs) << Math.min(attempt, 10);
        long half = upper / 2;
        return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(0L, half + 1));
    }

    private void backoff(String key, int attempt) {
        try {
            Thread.sleep(backoffFor(attempt).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(key);
        }
    }
}

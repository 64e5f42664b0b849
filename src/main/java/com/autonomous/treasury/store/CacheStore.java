package com.autonomous.treasury.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fast key-value store holding the authoritative balance state. Implementations must make
 * {@link #compareAndSet} atomic across every process sharing the store.
 *
 * <p>A {@code null} ttl means the key never expires.</p>
 */
public interface CacheStore {

    Optional<Versioned<String>> get(String key);

    /**
     * Writes {@code value} only if the key is still at {@code expectedVersion}
     * ({@code 0} = must be absent).
     *
     * @return whether the write happened
     */
    boolean compareAndSet(String key, long expectedVersion, String value, Duration ttl);

    void put(String key, String value, Duration ttl);

    long increment(String key, Duration ttl);

    /**
     * Prepends to a bounded list, newest first, trimming it to {@code maxEntries}.
     */
    void pushRecent(String key, String value, int maxEntries, Duration ttl);

    List<String> recent(String key, int limit);
}

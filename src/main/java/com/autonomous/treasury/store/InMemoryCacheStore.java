package com.autonomous.treasury.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link CacheStore}. Atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemoryCacheStore implements CacheStore {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, RecentList> lists = new ConcurrentHashMap<>();

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Versioned<String>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(new Versioned<>(entry.value, entry.version));
    }

    @Override
    public boolean compareAndSet(String key, long expectedVersion, String value, Duration ttl) {
        Instant now = clock.instant();
        boolean[] written = {false};
        entries.compute(key, (k, existing) -> {
            long current = existing == null || existing.isExpired(now) ? 0 : existing.version;
            if (current != expectedVersion) {
                return existing;
            }
            written[0] = true;
            // versions stay monotonic across expiry so a stale reader can never match
            long base = existing == null ? 0 : existing.version;
            return new Entry(value, base + 1, expiresAt(now, ttl));
        });
        return written[0];
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        entries.compute(key, (k, existing) ->
            new Entry(value, (existing == null ? 0 : existing.version) + 1, expiresAt(now, ttl)));
    }

    @Override
    public long increment(String key, Duration ttl) {
        Instant now = clock.instant();
        Entry updated = entries.compute(key, (k, existing) -> {
            boolean live = existing != null && !existing.isExpired(now);
            long next = live ? Long.parseLong(existing.value) + 1 : 1;
            Instant expiry = live ? existing.expiresAt : expiresAt(now, ttl);
            return new Entry(Long.toString(next), (existing == null ? 0 : existing.version) + 1, expiry);
        });
        return Long.parseLong(updated.value);
    }

    @Override
    public void pushRecent(String key, String value, int maxEntries, Duration ttl) {
        Instant now = clock.instant();
        lists.compute(key, (k, existing) -> {
            RecentList list = existing == null || existing.isExpired(now) ? new RecentList() : existing;
            list.items.addFirst(value);
            while (list.items.size() > maxEntries) {
                list.items.removeLast();
            }
            list.expiresAt = expiresAt(now, ttl);
            return list;
        });
    }

    @Override
    public List<String> recent(String key, int limit) {
        List<String> result = new ArrayList<>();
        lists.computeIfPresent(key, (k, list) -> {
            if (list.isExpired(clock.instant())) {
                return null;
            }
            list.items.stream().limit(limit).forEach(result::add);
            return list;
        });
        return result;
    }

    private static Instant expiresAt(Instant now, Duration ttl) {
        return ttl == null ? null : now.plus(ttl);
    }

    private static final class Entry {
        final String value;
        final long version;
        final Instant expiresAt;

        Entry(String value, long version, Instant expiresAt) {
            this.value = value;
            this.version = version;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private static final class RecentList {
        final Deque<String> items = new LinkedList<>();
        Instant expiresAt;

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}

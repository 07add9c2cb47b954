package com.dealhunt.aggregator.search.cache;

import com.dealhunt.aggregator.search.model.CacheEntry;
import com.dealhunt.aggregator.search.model.CacheStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key/value store whose entries expire a fixed duration after they were written.
 * Expiry is checked lazily on read; {@link #clearExpired()} can be called to reclaim memory.
 * Entries are replaced wholesale on {@link #set}, never mutated.
 */
public class TtlCache<K, V> {
    private final Map<K, CacheEntry<K, V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    public TtlCache(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // only drop the entry we looked at; a concurrent set may already have replaced it
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(K key, V value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        Duration effectiveTtl = ttl == null || ttl.isNegative() ? defaultTtl : ttl;
        entries.put(key, CacheEntry.create(key, value, clock.instant(), effectiveTtl));
    }

    public Optional<CacheEntry<K, V>> entry(K key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    public int clearExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<K, CacheEntry<K, V>> candidate : entries.entrySet()) {
            if (candidate.getValue().isExpired(now) && entries.remove(candidate.getKey(), candidate.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        int total = 0;
        int expired = 0;
        for (CacheEntry<K, V> entry : entries.values()) {
            total++;
            if (entry.isExpired(now)) {
                expired++;
            }
        }
        return new CacheStats(total, total - expired, expired);
    }
}

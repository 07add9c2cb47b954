package com.dealhunt.aggregator.search.model;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<K, V>(K key, V value, Instant createdAt, Duration ttl, Instant expiresAt) {

    public static <K, V> CacheEntry<K, V> create(K key, V value, Instant now, Duration ttl) {
        return new CacheEntry<>(key, value, now, ttl, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}

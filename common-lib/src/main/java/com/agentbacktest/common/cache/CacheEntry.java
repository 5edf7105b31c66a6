package com.agentbacktest.common.cache;

import java.time.Instant;

/**
 * Immutable cache slot. Access-time updates replace the entry rather than mutate it.
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant createdAt,
    Instant lastAccessedAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CacheEntry<V> touchedAt(Instant now) {
        return new CacheEntry<>(key, value, createdAt, now, expiresAt);
    }
}

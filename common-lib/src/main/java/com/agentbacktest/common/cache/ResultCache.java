package com.agentbacktest.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TTL + capacity bounded cache of prior agent outputs.
 *
 * <p>Lookups never return an expired value: expiry is checked on every access, and
 * expired entries are swept before LRU eviction is considered, so a live entry is never
 * evicted while a dead one still occupies a slot.
 *
 * <p>All operations are serialized by a single lock; the critical sections are short
 * map operations only.
 */
public class ResultCache<V> {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final int capacity;
    private final Duration defaultTtl;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ResultCache(int capacity, Duration defaultTtl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive, was " + defaultTtl);
        }
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            entries.put(key, entry.touchedAt(now));
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, V value, Duration ttl) {
        Instant now = clock.instant();
        lock.lock();
        try {
            sweepExpiredLocked(now);
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                Iterator<Map.Entry<String, CacheEntry<V>>> eldest = entries.entrySet().iterator();
                String evicted = eldest.next().getKey();
                eldest.remove();
                evictions++;
                log.debug("[ResultCache] LRU eviction key={}", evicted);
            }
            entries.put(key, new CacheEntry<>(key, value, now, now, now.plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    /** Removes every expired entry; returns how many were removed. */
    public int sweepExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            return sweepExpiredLocked(now);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, expirations, entries.size());
        } finally {
            lock.unlock();
        }
    }

    private int sweepExpiredLocked(Instant now) {
        int removed = 0;
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }
}

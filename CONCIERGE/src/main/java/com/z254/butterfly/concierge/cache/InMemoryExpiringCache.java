package com.z254.butterfly.concierge.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process expiring cache.
 * <p>
 * Expired entries are dropped lazily when read or counted. When the store is full and a new key arrives,
 * the entry closest to expiry is evicted, regardless of insertion order or access recency.
 * Every operation holds a single lock; eviction is a linear scan.
 */
@Slf4j
public class InMemoryExpiringCache implements ExpiringCache {

    private final Map<String, CacheEntry> store = new HashMap<>();
    private final Object lock = new Object();
    private final Duration defaultTtl;
    private final int maxSize;
    private final Clock clock;

    public InMemoryExpiringCache(Duration defaultTtl, int maxSize, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Default TTL must be positive: " + defaultTtl);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("Max size must be at least 1: " + maxSize);
        }
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String key) {
        synchronized (lock) {
            CacheEntry entry = store.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (clock.instant().isAfter(entry.expiresAt())) {
                store.remove(key);
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value());
        }
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key)
                .filter(type::isInstance)
                .map(type::cast);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        Instant expiresAt = clock.instant().plus(effectiveTtl);
        synchronized (lock) {
            if (store.size() >= maxSize && !store.containsKey(key)) {
                evictNearestExpiry();
            }
            store.put(key, new CacheEntry(value, expiresAt));
        }
    }

    @Override
    public void delete(String key) {
        synchronized (lock) {
            store.remove(key);
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            store.clear();
        }
    }

    @Override
    public long size() {
        synchronized (lock) {
            purgeExpired();
            return store.size();
        }
    }

    @Override
    public CacheBackendType getBackendType() {
        return CacheBackendType.IN_MEMORY;
    }

    // Caller holds the lock.
    private void purgeExpired() {
        Instant now = clock.instant();
        store.values().removeIf(entry -> now.isAfter(entry.expiresAt()));
    }

    // Caller holds the lock.
    private void evictNearestExpiry() {
        String victim = null;
        Instant earliest = null;
        for (Map.Entry<String, CacheEntry> candidate : store.entrySet()) {
            Instant expiresAt = candidate.getValue().expiresAt();
            if (earliest == null || expiresAt.isBefore(earliest)) {
                earliest = expiresAt;
                victim = candidate.getKey();
            }
        }
        if (victim != null) {
            store.remove(victim);
            log.debug("Evicted cache entry {} (expiresAt={})", victim, earliest);
        }
    }

    private record CacheEntry(Object value, Instant expiresAt) {
    }
}

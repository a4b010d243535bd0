package com.z254.butterfly.concierge.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with a time-to-live on every entry.
 * Implementations are safe for concurrent use.
 */
public interface ExpiringCache {

    /**
     * Get a live value.
     *
     * @param key the key
     * @return the value, or empty if missing or expired
     */
    Optional<Object> get(String key);

    /**
     * Get a live value converted to the requested type.
     *
     * @param key the key
     * @param type the expected value type
     * @return the value, or empty if missing, expired or not of the requested type
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store a value with the cache's default TTL.
     *
     * @param key the key
     * @param value the value
     */
    default void set(String key, Object value) {
        set(key, value, null);
    }

    /**
     * Store a value.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live, or null (or a non-positive duration) for the default TTL
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Remove a key. Missing keys are ignored.
     *
     * @param key the key
     */
    void delete(String key);

    /**
     * Remove every entry owned by this cache.
     */
    void clear();

    /**
     * Number of entries held. Approximate for distributed backends.
     *
     * @return entry count
     */
    long size();

    /**
     * @return the backend this cache runs on
     */
    CacheBackendType getBackendType();
}

package com.z254.butterfly.concierge.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates named caches once and hands out the same instance afterwards.
 * The backend of each cache is decided on first creation and never changes.
 */
@Slf4j
public class ExpiringCacheFactory {

    private final CacheBackendSelector selector;
    private final Map<String, ExpiringCache> caches = new ConcurrentHashMap<>();

    public ExpiringCacheFactory(CacheBackendSelector selector) {
        this.selector = selector;
    }

    /**
     * Get the cache with the settings' name, creating it on first request.
     *
     * @param settings cache settings
     * @return the cache
     */
    public ExpiringCache getOrCreate(CacheSettings settings) {
        return caches.computeIfAbsent(settings.getName(), name -> selector.select(settings));
    }

    /**
     * Backend chosen for every cache created so far.
     *
     * @return cache name to backend type
     */
    public Map<String, CacheBackendType> getBackendTypes() {
        Map<String, CacheBackendType> types = new LinkedHashMap<>();
        caches.forEach((name, cache) -> types.put(name, cache.getBackendType()));
        return Collections.unmodifiableMap(types);
    }

    /**
     * Forget every cache so the next request re-runs backend selection. Intended for tests.
     */
    public void reset() {
        log.debug("Resetting {} cache(s)", caches.size());
        caches.clear();
    }
}

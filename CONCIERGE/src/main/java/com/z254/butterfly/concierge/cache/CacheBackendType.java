package com.z254.butterfly.concierge.cache;

/**
 * Storage backends an {@link ExpiringCache} can run on.
 */
public enum CacheBackendType {
    REDIS,
    IN_MEMORY
}

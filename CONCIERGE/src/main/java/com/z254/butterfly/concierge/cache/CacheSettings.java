package com.z254.butterfly.concierge.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings for one named cache.
 */
@Value
@Builder
public class CacheSettings {

    /**
     * Logical cache name, unique per process.
     */
    String name;

    /**
     * Prefix applied to every key in a shared store.
     */
    String keyPrefix;

    Duration defaultTtl;

    /**
     * Capacity of the in-process backend. Redis relies on its own memory policy.
     */
    int maxSize;
}

package com.z254.butterfly.concierge.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed expiring cache.
 * <p>
 * Values are stored as JSON strings with native key expiry. Every key is namespaced by a prefix
 * so several logical caches can share one Redis database.
 */
@Slf4j
public class RedisExpiringCache implements ExpiringCache {

    private static final int SCAN_BATCH_SIZE = 100;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration defaultTtl;

    public RedisExpiringCache(StringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper,
                              String keyPrefix,
                              Duration defaultTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Optional<Object> get(String key) {
        return get(key, Object.class);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String raw = redisTemplate.opsForValue().get(prefixed(key));
        if (raw == null) {
            return Optional.empty();
        }
        Object value;
        try {
            value = objectMapper.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            log.warn("Cache: corrupt value for key={}, deleting", key);
            redisTemplate.delete(prefixed(key));
            return Optional.empty();
        }
        if (value == null || type == Object.class || type.isInstance(value)) {
            return Optional.ofNullable(value).map(type::cast);
        }
        try {
            return Optional.ofNullable(objectMapper.convertValue(value, type));
        } catch (IllegalArgumentException e) {
            log.debug("Cache: value for key={} is not a {}", key, type.getSimpleName());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key " + key + " is not JSON-serializable", e);
        }
        redisTemplate.opsForValue().set(prefixed(key), json, effectiveTtl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(prefixed(key));
    }

    /**
     * Delete every key carrying this cache's prefix. Other prefixes in a shared Redis are untouched.
     */
    @Override
    public void clear() {
        List<String> batch = new ArrayList<>(SCAN_BATCH_SIZE);
        try (Cursor<String> cursor = redisTemplate.scan(scanOptions())) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH_SIZE) {
                    redisTemplate.delete(batch);
                    batch = new ArrayList<>(SCAN_BATCH_SIZE);
                }
            }
        }
        if (!batch.isEmpty()) {
            redisTemplate.delete(batch);
        }
    }

    /**
     * Count keys carrying this cache's prefix. Approximate while other writers are active.
     */
    @Override
    public long size() {
        long count = 0;
        try (Cursor<String> cursor = redisTemplate.scan(scanOptions())) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return count;
    }

    @Override
    public CacheBackendType getBackendType() {
        return CacheBackendType.REDIS;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    private ScanOptions scanOptions() {
        return ScanOptions.scanOptions()
                .match(keyPrefix + "*")
                .count(SCAN_BATCH_SIZE)
                .build();
    }

    private String prefixed(String key) {
        return keyPrefix + key;
    }
}

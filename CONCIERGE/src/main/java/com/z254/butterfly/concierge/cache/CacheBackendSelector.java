package com.z254.butterfly.concierge.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Chooses the backend for a named cache.
 * <p>
 * Redis is preferred when enabled and reachable (PING answered with PONG). Any failure while
 * building or probing the Redis backend falls back to {@link InMemoryExpiringCache}.
 */
@Slf4j
public class CacheBackendSelector {

    private final RedisConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean redisEnabled;

    /**
     * @param connectionFactory Redis connection factory, or null when Redis is not configured
     * @param objectMapper mapper for JSON values stored in Redis
     * @param clock time source for the in-process backend
     * @param redisEnabled whether Redis should be attempted at all
     */
    public CacheBackendSelector(RedisConnectionFactory connectionFactory,
                                ObjectMapper objectMapper,
                                Clock clock,
                                boolean redisEnabled) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.redisEnabled = redisEnabled;
    }

    /**
     * Build the cache described by the settings on the best available backend.
     *
     * @param settings cache settings
     * @return a ready cache
     */
    public ExpiringCache select(CacheSettings settings) {
        if (redisEnabled && connectionFactory != null) {
            try {
                probe();
                log.info("Cache[{}]: using Redis (prefix={})", settings.getName(), settings.getKeyPrefix());
                return new RedisExpiringCache(
                        new StringRedisTemplate(connectionFactory),
                        objectMapper,
                        settings.getKeyPrefix(),
                        settings.getDefaultTtl());
            } catch (RuntimeException e) {
                log.info("Cache[{}]: Redis unavailable ({}), using in-memory cache",
                        settings.getName(), e.getMessage());
            }
        }
        log.info("Cache[{}]: using in-memory cache (maxSize={}, defaultTtl={})",
                settings.getName(), settings.getMaxSize(), settings.getDefaultTtl());
        return new InMemoryExpiringCache(settings.getDefaultTtl(), settings.getMaxSize(), clock);
    }

    private void probe() {
        RedisConnection connection = connectionFactory.getConnection();
        try {
            String reply = connection.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new IllegalStateException("Unexpected PING reply: " + reply);
            }
        } finally {
            connection.close();
        }
    }
}

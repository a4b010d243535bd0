package com.z254.butterfly.concierge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.concierge.cache.CacheBackendSelector;
import com.z254.butterfly.concierge.cache.CacheSettings;
import com.z254.butterfly.concierge.cache.ExpiringCache;
import com.z254.butterfly.concierge.cache.ExpiringCacheFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Clock;

/**
 * Cache configuration for CONCIERGE service.
 * Backend selection runs here, once per named cache, while the context starts.
 */
@Configuration
public class CacheConfig {

    public static final String RESULT_CACHE = "results";
    public static final String SESSION_CACHE = "sessions";

    @Bean
    public Clock conciergeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheBackendSelector cacheBackendSelector(
            ObjectProvider<RedisConnectionFactory> connectionFactory,
            ObjectMapper objectMapper,
            Clock conciergeClock,
            ConciergeProperties conciergeProperties) {
        return new CacheBackendSelector(
                connectionFactory.getIfAvailable(),
                objectMapper,
                conciergeClock,
                conciergeProperties.getRedis().isEnabled());
    }

    @Bean
    public ExpiringCacheFactory expiringCacheFactory(CacheBackendSelector cacheBackendSelector) {
        return new ExpiringCacheFactory(cacheBackendSelector);
    }

    @Bean
    public ExpiringCache resultCache(ExpiringCacheFactory factory, ConciergeProperties conciergeProperties) {
        ConciergeProperties.CacheProperties config = conciergeProperties.getCache();
        return factory.getOrCreate(CacheSettings.builder()
                .name(RESULT_CACHE)
                .keyPrefix(config.getKeyPrefix())
                .defaultTtl(config.getDefaultTtl())
                .maxSize(config.getMaxSize())
                .build());
    }

    @Bean
    public ExpiringCache sessionCache(ExpiringCacheFactory factory, ConciergeProperties conciergeProperties) {
        ConciergeProperties.SessionProperties config = conciergeProperties.getSession();
        return factory.getOrCreate(CacheSettings.builder()
                .name(SESSION_CACHE)
                .keyPrefix(config.getKeyPrefix())
                .defaultTtl(config.getTtl())
                .maxSize(config.getMaxInMemory())
                .build());
    }
}

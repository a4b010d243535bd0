package com.z254.butterfly.concierge.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.concierge.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CacheBackendSelector} and {@link ExpiringCacheFactory}.
 */
@ExtendWith(MockitoExtension.class)
class CacheBackendSelectorTest {

    private static final CacheSettings RESULTS = CacheSettings.builder()
            .name("results")
            .keyPrefix("smartshop:")
            .defaultTtl(Duration.ofHours(1))
            .maxSize(1000)
            .build();

    private static final CacheSettings SESSIONS = CacheSettings.builder()
            .name("sessions")
            .keyPrefix("session:")
            .defaultTtl(Duration.ofMinutes(30))
            .maxSize(200)
            .build();

    @Mock
    private RedisConnectionFactory connectionFactory;

    @Mock
    private RedisConnection connection;

    private CacheBackendSelector selector(boolean redisEnabled) {
        return new CacheBackendSelector(connectionFactory, new ObjectMapper(), new MutableClock(), redisEnabled);
    }

    @Nested
    @DisplayName("Backend selection")
    class SelectionTests {

        @Test
        @DisplayName("should use Redis when PING answers PONG")
        void usesRedisWhenReachable() {
            when(connectionFactory.getConnection()).thenReturn(connection);
            when(connection.ping()).thenReturn("PONG");

            ExpiringCache cache = selector(true).select(RESULTS);

            assertThat(cache).isInstanceOf(RedisExpiringCache.class);
            assertThat(cache.getBackendType()).isEqualTo(CacheBackendType.REDIS);
            assertThat(((RedisExpiringCache) cache).getKeyPrefix()).isEqualTo("smartshop:");
            verify(connection).close();
        }

        @Test
        @DisplayName("should fall back to memory when PING fails")
        void fallsBackWhenPingFails() {
            when(connectionFactory.getConnection()).thenReturn(connection);
            when(connection.ping()).thenThrow(new RedisConnectionFailureException("refused"));

            ExpiringCache cache = selector(true).select(RESULTS);

            assertThat(cache.getBackendType()).isEqualTo(CacheBackendType.IN_MEMORY);
            verify(connection).close();
        }

        @Test
        @DisplayName("should fall back to memory when no connection can be opened")
        void fallsBackWhenConnectionFails() {
            when(connectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("refused"));

            ExpiringCache cache = selector(true).select(RESULTS);

            assertThat(cache.getBackendType()).isEqualTo(CacheBackendType.IN_MEMORY);
        }

        @Test
        @DisplayName("should fall back to memory on an unexpected PING reply")
        void fallsBackOnUnexpectedReply() {
            when(connectionFactory.getConnection()).thenReturn(connection);
            when(connection.ping()).thenReturn("LOADING");

            assertThat(selector(true).select(RESULTS).getBackendType()).isEqualTo(CacheBackendType.IN_MEMORY);
        }

        @Test
        @DisplayName("should not probe Redis when disabled")
        void skipsRedisWhenDisabled() {
            ExpiringCache cache = selector(false).select(RESULTS);

            assertThat(cache.getBackendType()).isEqualTo(CacheBackendType.IN_MEMORY);
            verifyNoInteractions(connectionFactory);
        }

        @Test
        @DisplayName("should use memory when no connection factory is configured")
        void memoryWithoutFactory() {
            CacheBackendSelector selector = new CacheBackendSelector(null, new ObjectMapper(), new MutableClock(), true);

            assertThat(selector.select(RESULTS).getBackendType()).isEqualTo(CacheBackendType.IN_MEMORY);
        }
    }

    @Nested
    @DisplayName("Factory")
    class FactoryTests {

        @Test
        @DisplayName("should create each named cache once")
        void memoizesByName() {
            ExpiringCacheFactory factory = new ExpiringCacheFactory(selector(false));

            ExpiringCache first = factory.getOrCreate(RESULTS);
            ExpiringCache second = factory.getOrCreate(RESULTS);
            ExpiringCache sessions = factory.getOrCreate(SESSIONS);

            assertThat(second).isSameAs(first);
            assertThat(sessions).isNotSameAs(first);
            assertThat(factory.getBackendTypes())
                    .containsEntry("results", CacheBackendType.IN_MEMORY)
                    .containsEntry("sessions", CacheBackendType.IN_MEMORY);
        }

        @Test
        @DisplayName("should re-run selection after reset")
        void resetForgetsCaches() {
            ExpiringCacheFactory factory = new ExpiringCacheFactory(selector(false));
            ExpiringCache first = factory.getOrCreate(RESULTS);
            first.set("a", 1);

            factory.reset();
            ExpiringCache recreated = factory.getOrCreate(RESULTS);

            assertThat(recreated).isNotSameAs(first);
            assertThat(recreated.get("a")).isEmpty();
        }
    }
}

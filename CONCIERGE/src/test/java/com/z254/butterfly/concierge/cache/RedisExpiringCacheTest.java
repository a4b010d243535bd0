package com.z254.butterfly.concierge.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RedisExpiringCache}.
 */
@ExtendWith(MockitoExtension.class)
class RedisExpiringCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private Cursor<String> cursor;

    private RedisExpiringCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisExpiringCache(redisTemplate, new ObjectMapper(), "smartshop:", Duration.ofHours(1));
    }

    @Nested
    @DisplayName("Get")
    class GetTests {

        @BeforeEach
        void stubOps() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        }

        @Test
        @DisplayName("should return empty when the key is missing")
        void missingKey() {
            when(valueOperations.get("smartshop:a")).thenReturn(null);

            assertThat(cache.get("a")).isEmpty();
        }

        @Test
        @DisplayName("should decode JSON values")
        void decodesJson() {
            when(valueOperations.get("smartshop:a")).thenReturn("{\"answer\":\"hi\",\"count\":2}");

            assertThat(cache.get("a")).contains(Map.of("answer", "hi", "count", 2));
        }

        @Test
        @DisplayName("should decode typed values")
        void decodesTyped() {
            when(valueOperations.get("smartshop:a")).thenReturn("\"hello\"");

            assertThat(cache.get("a", String.class)).contains("hello");
        }

        @Test
        @DisplayName("should keep values of another type")
        void keepsMismatchedType() {
            when(valueOperations.get("smartshop:a")).thenReturn("{\"answer\":\"hi\"}");

            assertThat(cache.get("a", String.class)).isEmpty();
            verify(redisTemplate, never()).delete("smartshop:a");
        }

        @Test
        @DisplayName("should delete and hide corrupt values")
        void deletesCorrupt() {
            when(valueOperations.get("smartshop:a")).thenReturn("{not json");

            assertThat(cache.get("a")).isEmpty();
            verify(redisTemplate).delete("smartshop:a");
        }
    }

    @Nested
    @DisplayName("Set")
    class SetTests {

        @BeforeEach
        void stubOps() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        }

        @Test
        @DisplayName("should store JSON with the default TTL")
        void storesWithDefaultTtl() {
            cache.set("a", Map.of("answer", "hi"));

            verify(valueOperations).set("smartshop:a", "{\"answer\":\"hi\"}", Duration.ofHours(1));
        }

        @Test
        @DisplayName("should store JSON with an explicit TTL")
        void storesWithExplicitTtl() {
            cache.set("a", List.of(1, 2), Duration.ofMinutes(5));

            verify(valueOperations).set("smartshop:a", "[1,2]", Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("should fall back to the default TTL for non-positive durations")
        void nonPositiveTtl() {
            cache.set("a", "x", Duration.ZERO);

            verify(valueOperations).set("smartshop:a", "\"x\"", Duration.ofHours(1));
        }
    }

    @Nested
    @DisplayName("Scan-based operations")
    class ScanTests {

        @BeforeEach
        void stubScan() {
            when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
            when(cursor.hasNext()).thenReturn(true, true, false);
            when(cursor.next()).thenReturn("smartshop:a", "smartshop:b");
        }

        @Test
        @DisplayName("should delete every key under the prefix")
        void clearDeletesPrefixedKeys() {
            cache.clear();

            verify(redisTemplate).delete(List.of("smartshop:a", "smartshop:b"));
            verify(cursor).close();
        }

        @Test
        @DisplayName("should count keys under the prefix")
        void sizeCountsKeys() {
            assertThat(cache.size()).isEqualTo(2);
            verify(cursor).close();
        }
    }

    @Test
    @DisplayName("should delete prefixed keys")
    void deleteUsesPrefix() {
        cache.delete("a");

        verify(redisTemplate).delete("smartshop:a");
    }

    @Test
    @DisplayName("should report the Redis backend")
    void backendType() {
        assertThat(cache.getBackendType()).isEqualTo(CacheBackendType.REDIS);
        assertThat(cache.getKeyPrefix()).isEqualTo("smartshop:");
    }
}

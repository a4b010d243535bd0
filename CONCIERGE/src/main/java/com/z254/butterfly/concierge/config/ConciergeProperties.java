package com.z254.butterfly.concierge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for CONCIERGE service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "concierge")
public class ConciergeProperties {

    private RedisProperties redis = new RedisProperties();
    private CacheProperties cache = new CacheProperties();
    private SessionProperties session = new SessionProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private LLMProperties llm = new LLMProperties();

    @Data
    public static class RedisProperties {
        /**
         * When false, every cache uses the in-process backend without probing Redis.
         */
        private boolean enabled = true;
    }

    /**
     * Result cache used by capabilities to memoize expensive answers.
     */
    @Data
    public static class CacheProperties {
        private Duration defaultTtl = Duration.ofHours(1);
        private int maxSize = 1000;
        private String keyPrefix = "smartshop:";
    }

    @Data
    public static class SessionProperties {
        private Duration ttl = Duration.ofMinutes(30);
        private int maxInMemory = 200;
        private int maxPairs = 10;
        private String keyPrefix = "session:";
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class LLMProperties {
        private OpenAIProperties openai = new OpenAIProperties();

        @Data
        public static class OpenAIProperties {
            private String apiKey;
            private String baseUrl = "https://api.openai.com/v1";
            private String model = "gpt-4o-mini";
            private int maxTokens = 1500;
            private double temperature = 0.7;
            private Duration timeout = Duration.ofSeconds(30);
        }
    }
}

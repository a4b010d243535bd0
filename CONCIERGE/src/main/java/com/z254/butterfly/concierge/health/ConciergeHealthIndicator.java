package com.z254.butterfly.concierge.health;

import com.z254.butterfly.concierge.cache.ExpiringCacheFactory;
import com.z254.butterfly.concierge.capability.CapabilityNames;
import com.z254.butterfly.concierge.orchestration.Orchestrator;
import com.z254.butterfly.concierge.resilience.CircuitBreaker;
import com.z254.butterfly.concierge.resilience.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for CONCIERGE service.
 * Reports the backend of each named cache and the state of each capability breaker.
 * DOWN when the general breaker is OPEN, since nothing is left to reroute to.
 */
@Component
@Slf4j
public class ConciergeHealthIndicator implements ReactiveHealthIndicator {

    private final Orchestrator orchestrator;
    private final ExpiringCacheFactory cacheFactory;

    public ConciergeHealthIndicator(Orchestrator orchestrator, ExpiringCacheFactory cacheFactory) {
        this.orchestrator = orchestrator;
        this.cacheFactory = cacheFactory;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::check)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }

    private Health check() {
        Map<String, String> breakers = new LinkedHashMap<>();
        boolean generalOpen = false;
        for (Map.Entry<String, CircuitBreaker> entry : orchestrator.getCircuitBreakers().entrySet()) {
            CircuitState state = entry.getValue().currentState();
            breakers.put(entry.getKey(), state.name());
            if (CapabilityNames.GENERAL.equals(entry.getKey()) && state == CircuitState.OPEN) {
                generalOpen = true;
            }
        }

        Map<String, String> caches = new LinkedHashMap<>();
        cacheFactory.getBackendTypes().forEach((name, type) -> caches.put(name, type.name()));

        Health.Builder builder = generalOpen ? Health.down() : Health.up();
        return builder
                .withDetail("circuitBreakers", breakers)
                .withDetail("caches", caches)
                .build();
    }
}

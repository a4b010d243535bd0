package com.z254.butterfly.concierge.config;

import com.z254.butterfly.concierge.capability.CapabilityRegistry;
import com.z254.butterfly.concierge.intent.IntentResolver;
import com.z254.butterfly.concierge.orchestration.Orchestrator;
import com.z254.butterfly.concierge.orchestration.OrchestratorImpl;
import com.z254.butterfly.concierge.resilience.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the orchestrator with one circuit breaker per registered capability.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Orchestrator orchestrator(IntentResolver intentResolver,
                                     CapabilityRegistry capabilityRegistry,
                                     ConciergeProperties conciergeProperties,
                                     Clock conciergeClock,
                                     MeterRegistry meterRegistry) {
        ConciergeProperties.CircuitBreakerProperties config = conciergeProperties.getCircuitBreaker();
        return new OrchestratorImpl(
                intentResolver,
                capabilityRegistry,
                name -> new CircuitBreaker(name, config.getFailureThreshold(), config.getRecoveryTimeout(),
                        conciergeClock),
                meterRegistry);
    }
}

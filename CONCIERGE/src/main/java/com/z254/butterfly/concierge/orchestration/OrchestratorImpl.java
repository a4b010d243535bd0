package com.z254.butterfly.concierge.orchestration;

import com.z254.butterfly.concierge.capability.Capability;
import com.z254.butterfly.concierge.capability.CapabilityNames;
import com.z254.butterfly.concierge.capability.CapabilityRegistry;
import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.intent.IntentResolver;
import com.z254.butterfly.concierge.intent.IntentResult;
import com.z254.butterfly.concierge.intent.IntentType;
import com.z254.butterfly.concierge.resilience.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Default {@link Orchestrator}.
 * <p>
 * Routing:
 * <ul>
 *   <li>COMPARISON goes to the recommendation capability with {@code compare_mode=true}</li>
 *   <li>every other intent goes to the capability of the same name</li>
 *   <li>an absent capability, or one whose breaker is OPEN, is replaced by general</li>
 *   <li>a capability that signals an error is replaced by general, called with the caller's context</li>
 * </ul>
 * Each capability is invoked at most once per request. When general is itself the target, including
 * after a reroute, an error from it is not followed by a second general call: the request ends as a
 * failure response with no capability key.
 */
@Slf4j
public class OrchestratorImpl implements Orchestrator {

    static final String STRUCTURED_HINTS = "structured_hints";
    static final String COMPARE_MODE = "compare_mode";

    private final IntentResolver intentResolver;
    private final CapabilityRegistry registry;
    private final Map<String, CircuitBreaker> circuitBreakers;
    private final MeterRegistry meterRegistry;

    private final Counter rerouteCounter;
    private final Counter fallbackCounter;
    private final Counter totalFailureCounter;

    /**
     * @param intentResolver classifier for incoming queries
     * @param registry capabilities by name
     * @param breakerFactory creates the breaker for a capability name
     * @param meterRegistry registry for routing meters
     */
    public OrchestratorImpl(IntentResolver intentResolver,
                            CapabilityRegistry registry,
                            Function<String, CircuitBreaker> breakerFactory,
                            MeterRegistry meterRegistry) {
        this.intentResolver = intentResolver;
        this.registry = registry;
        this.meterRegistry = meterRegistry;

        Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
        for (String name : registry.getNames()) {
            CircuitBreaker breaker = breakerFactory.apply(name);
            breakers.put(name, breaker);
            Gauge.builder("concierge.circuit_breaker.state", breaker, b -> b.currentState().getGaugeValue())
                    .description("Circuit breaker state (0 closed, 1 half-open, 2 open)")
                    .tag("capability", name)
                    .register(meterRegistry);
        }
        this.circuitBreakers = Collections.unmodifiableMap(breakers);

        this.rerouteCounter = Counter.builder("concierge.orchestrator.reroutes")
                .description("Requests rerouted to general before invocation")
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("concierge.orchestrator.fallbacks")
                .description("Requests answered by general after a capability error")
                .register(meterRegistry);
        this.totalFailureCounter = Counter.builder("concierge.orchestrator.total_failures")
                .description("Requests no capability could answer")
                .register(meterRegistry);
    }

    @Override
    public Mono<OrchestrationResult> handle(String query, Map<String, Object> context) {
        Map<String, Object> callerContext = context != null ? context : Map.of();

        return Mono.defer(() -> intentResolver.classify(query))
                .onErrorResume(e -> Mono.just(IntentResult.fallback(String.valueOf(e.getMessage()))))
                .defaultIfEmpty(IntentResult.fallback("no classification produced"))
                .flatMap(intent -> route(query, callerContext, intent));
    }

    @Override
    public Map<String, CircuitBreaker> getCircuitBreakers() {
        return circuitBreakers;
    }

    private Mono<OrchestrationResult> route(String query, Map<String, Object> callerContext, IntentResult intent) {
        Map<String, Object> context = new HashMap<>(callerContext);
        Map<String, Object> hints = intent.structuredHints();
        if (!hints.isEmpty()) {
            context.put(STRUCTURED_HINTS, hints);
        }

        String key = intent.getIntent().getValue();
        if (intent.getIntent() == IntentType.COMPARISON) {
            key = CapabilityNames.RECOMMENDATION;
            context.put(COMPARE_MODE, true);
        }

        Capability capability = registry.find(key).orElse(null);
        CircuitBreaker breaker = circuitBreakers.get(key);

        if (capability == null || (breaker != null && !breaker.isAvailable())) {
            log.warn("Orchestrator: '{}' unavailable, routing to general", key);
            rerouteCounter.increment();
            key = CapabilityNames.GENERAL;
            capability = registry.getGeneral();
            breaker = circuitBreakers.get(key);
        }

        String capabilityKey = key;
        Capability target = capability;
        CircuitBreaker targetBreaker = breaker;
        requestCounter(capabilityKey).increment();

        return Mono.defer(() -> target.process(query, context))
                .switchIfEmpty(Mono.error(
                        new IllegalStateException("Capability '" + capabilityKey + "' returned no response")))
                .doOnNext(response -> {
                    if (targetBreaker == null) {
                        return;
                    }
                    if (response.isSuccess()) {
                        targetBreaker.recordSuccess();
                    } else {
                        targetBreaker.recordFailure();
                    }
                })
                .map(response -> result(response, intent, capabilityKey))
                .onErrorResume(e -> fallback(query, callerContext, intent, capabilityKey, targetBreaker, e));
    }

    private Mono<OrchestrationResult> fallback(String query,
                                               Map<String, Object> callerContext,
                                               IntentResult intent,
                                               String failedKey,
                                               CircuitBreaker failedBreaker,
                                               Throwable error) {
        log.error("Orchestrator: '{}' raised: {}", failedKey, error.getMessage(), error);
        if (failedBreaker != null) {
            failedBreaker.recordFailure();
        }

        Capability general = registry.getGeneral();
        if (general == null || CapabilityNames.GENERAL.equals(failedKey)) {
            return Mono.just(totalFailure(intent, error));
        }

        fallbackCounter.increment();
        return Mono.defer(() -> general.process(query, new HashMap<>(callerContext)))
                .switchIfEmpty(Mono.error(new IllegalStateException("Capability 'general' returned no response")))
                .map(response -> result(response, intent, CapabilityNames.GENERAL))
                .onErrorResume(e -> {
                    log.error("Orchestrator: general fallback raised: {}", e.getMessage());
                    return Mono.just(totalFailure(intent, e));
                });
    }

    private OrchestrationResult totalFailure(IntentResult intent, Throwable error) {
        totalFailureCounter.increment();
        return result(CapabilityResponse.failure(String.valueOf(error.getMessage())), intent, null);
    }

    private static OrchestrationResult result(CapabilityResponse response, IntentResult intent, String capabilityKey) {
        return OrchestrationResult.builder()
                .response(response)
                .intent(intent)
                .capabilityKey(capabilityKey)
                .build();
    }

    private Counter requestCounter(String capabilityKey) {
        return Counter.builder("concierge.orchestrator.requests")
                .description("Requests dispatched per capability")
                .tag("capability", capabilityKey)
                .register(meterRegistry);
    }
}

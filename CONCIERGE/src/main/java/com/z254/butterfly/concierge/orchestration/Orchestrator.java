package com.z254.butterfly.concierge.orchestration;

import com.z254.butterfly.concierge.resilience.CircuitBreaker;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Routes a query to the capability matching its intent.
 */
public interface Orchestrator {

    /**
     * Classify, route and execute a query.
     * <p>
     * Never signals an error. When no capability can answer, the result carries a response with
     * {@code success=false}. The intent in the result is always the original classification.
     *
     * @param query the query to answer
     * @param context caller context, copied and never modified
     * @return the response with the intent and the key of the capability that answered
     */
    Mono<OrchestrationResult> handle(String query, Map<String, Object> context);

    /**
     * One breaker per registered capability name.
     */
    Map<String, CircuitBreaker> getCircuitBreakers();
}

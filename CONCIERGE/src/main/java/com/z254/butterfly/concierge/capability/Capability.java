package com.z254.butterfly.concierge.capability;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A backend that answers one kind of query (recommendations, reviews, prices, policies or general).
 */
public interface Capability {

    /**
     * Registry key of this capability, one of {@link CapabilityNames}.
     */
    String getName();

    /**
     * Answer a query.
     * <p>
     * Expected failures are reported with {@code success=false}. An error signal means something
     * exceptional happened and counts against the capability's circuit breaker.
     *
     * @param query the (possibly context-enriched) query
     * @param context request context such as {@code structured_hints} or {@code compare_mode}
     * @return the response
     */
    Mono<CapabilityResponse> process(String query, Map<String, Object> context);
}

package com.z254.butterfly.concierge.intent;

import reactor.core.publisher.Mono;

/**
 * Classifies free-text queries into an {@link IntentResult}.
 */
public interface IntentResolver {

    /**
     * Classify a query.
     * <p>
     * Implementations must not signal errors; internal failures are reported as
     * {@link IntentResult#fallback(String)}.
     *
     * @param query the user query
     * @return the classification
     */
    Mono<IntentResult> classify(String query);
}

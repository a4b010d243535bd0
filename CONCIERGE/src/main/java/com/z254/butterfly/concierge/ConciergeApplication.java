package com.z254.butterfly.concierge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CONCIERGE - Conversational Request Router for the BUTTERFLY Ecosystem.
 *
 * <p>CONCIERGE provides:
 * <ul>
 *   <li>Intent Routing - Classifies free-text queries and dispatches them to a capability</li>
 *   <li>Failure Isolation - Per-capability circuit breakers with fallback to the general capability</li>
 *   <li>Expiring Caches - Redis-backed or in-process key/value stores with per-entry TTL</li>
 *   <li>Conversation Sessions - Bounded transcripts used to enrich follow-up queries</li>
 * </ul>
 *
 * <p>Routing keys:
 * <ul>
 *   <li>recommendation - Product suggestions, also serving comparisons in compare mode</li>
 *   <li>review - Customer opinion summaries</li>
 *   <li>price - Cross-retailer price lookup</li>
 *   <li>policy - Store policy questions</li>
 *   <li>general - Everything else, and the fallback for all of the above</li>
 * </ul>
 * Only general ships with this service. A key with no registered capability is routed to general.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class ConciergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConciergeApplication.class, args);
    }
}

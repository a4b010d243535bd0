package com.z254.butterfly.concierge.orchestration;

import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.intent.IntentResult;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of {@link Orchestrator#handle}.
 */
@Value
@Builder
public class OrchestrationResult {

    CapabilityResponse response;

    IntentResult intent;

    /**
     * Key of the capability that produced the response, or null when none did.
     */
    String capabilityKey;
}

package com.z254.butterfly.concierge.chat;

import com.z254.butterfly.concierge.orchestration.OrchestrationResult;
import lombok.Builder;
import lombok.Value;

/**
 * One answered chat message.
 */
@Value
@Builder
public class ChatTurn {

    String sessionId;

    /**
     * The message as the user sent it, before history enrichment.
     */
    String message;

    OrchestrationResult result;
}

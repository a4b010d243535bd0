package com.z254.butterfly.concierge.api.dto;

import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.chat.ChatTurn;
import com.z254.butterfly.concierge.intent.IntentResult;
import com.z254.butterfly.concierge.intent.IntentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String sessionId;
    private String message;
    private IntentType intent;
    private double confidence;
    private Map<String, Object> entities;
    private String agentUsed;
    private Map<String, Object> response;
    private boolean success;
    private String error;

    public static ChatResponse fromTurn(ChatTurn turn) {
        IntentResult intent = turn.getResult().getIntent();
        CapabilityResponse response = turn.getResult().getResponse();

        Object agent = response.getData().get("agent");
        String agentUsed = agent != null
                ? agent.toString()
                : turn.getResult().getCapabilityKey() != null ? turn.getResult().getCapabilityKey() : "unknown";

        return ChatResponse.builder()
                .sessionId(turn.getSessionId())
                .message(turn.getMessage())
                .intent(intent.getIntent())
                .confidence(intent.getConfidence())
                .entities(intent.entities())
                .agentUsed(agentUsed)
                .response(response.getData())
                .success(response.isSuccess())
                .error(response.getError())
                .build();
    }
}

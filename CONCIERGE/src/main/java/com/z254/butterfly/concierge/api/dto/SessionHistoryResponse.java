package com.z254.butterfly.concierge.api.dto;

import com.z254.butterfly.concierge.session.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Transcript of a session, oldest message first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionHistoryResponse {

    private String sessionId;
    private List<ChatMessage> messages;
    private int count;

    public static SessionHistoryResponse of(String sessionId, List<ChatMessage> messages) {
        return new SessionHistoryResponse(sessionId, messages, messages.size());
    }
}

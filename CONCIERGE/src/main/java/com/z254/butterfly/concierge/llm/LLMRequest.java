package com.z254.butterfly.concierge.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request object for LLM completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    /**
     * Model to use for completion. Provider default when null.
     */
    private String model;

    /**
     * Messages for the conversation.
     */
    private List<Message> messages;

    /**
     * Temperature for sampling (0.0 - 2.0). Provider default when null.
     */
    private Double temperature;

    /**
     * Maximum tokens to generate. Provider default when null.
     */
    private Integer maxTokens;

    /**
     * Response format.
     */
    private ResponseFormat responseFormat;

    /**
     * A message in the conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;  // system, user, assistant
        private String content;
    }

    /**
     * Requested response format.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseFormat {
        private String type;  // "text", "json_object"
    }

    public static Message systemMessage(String content) {
        return Message.builder()
                .role("system")
                .content(content)
                .build();
    }

    public static Message userMessage(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .build();
    }

    public static ResponseFormat jsonObject() {
        return ResponseFormat.builder().type("json_object").build();
    }
}

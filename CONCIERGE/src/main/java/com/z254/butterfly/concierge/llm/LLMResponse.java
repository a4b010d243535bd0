package com.z254.butterfly.concierge.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response object from LLM completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String model;

    private String providerId;

    /**
     * Generated content.
     */
    private String content;

    private FinishReason finishReason;

    private Usage usage;

    /**
     * Reasons for completion finish.
     */
    public enum FinishReason {
        STOP,           // Natural completion
        LENGTH,         // Hit max tokens
        CONTENT_FILTER  // Blocked by content filter
    }

    /**
     * Token usage statistics.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    /**
     * Get total tokens used.
     */
    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }

    /**
     * Create a simple text response.
     */
    public static LLMResponse text(String content, String model, String providerId) {
        return LLMResponse.builder()
                .content(content)
                .model(model)
                .providerId(providerId)
                .finishReason(FinishReason.STOP)
                .build();
    }
}

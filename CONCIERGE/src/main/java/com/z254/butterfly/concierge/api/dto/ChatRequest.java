package com.z254.butterfly.concierge.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "Message is required")
    @Size(max = 1000, message = "Message must be at most 1000 characters")
    private String message;

    /**
     * Session to continue. A new session is started when absent.
     */
    private String sessionId;

    @Builder.Default
    @Min(value = 1, message = "maxResults must be at least 1")
    @Max(value = 20, message = "maxResults must be at most 20")
    private int maxResults = 5;
}

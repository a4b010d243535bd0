package com.z254.butterfly.concierge.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for session creation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
}

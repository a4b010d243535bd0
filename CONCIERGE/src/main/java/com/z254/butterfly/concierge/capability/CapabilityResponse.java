package com.z254.butterfly.concierge.capability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a capability invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityResponse {

    private boolean success;

    /**
     * Payload, in insertion order.
     */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private String error;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static CapabilityResponse success(Map<String, Object> data) {
        return CapabilityResponse.builder()
                .success(true)
                .data(new LinkedHashMap<>(data))
                .build();
    }

    public static CapabilityResponse failure(String error) {
        return CapabilityResponse.builder()
                .success(false)
                .error(error)
                .build();
    }
}

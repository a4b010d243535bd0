package com.z254.butterfly.concierge.intent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of intents a query can be classified into.
 */
public enum IntentType {
    RECOMMENDATION("recommendation"),
    COMPARISON("comparison"),
    REVIEW("review"),
    POLICY("policy"),
    PRICE("price"),
    GENERAL("general");

    private final String value;

    IntentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire name, case-insensitively.
     *
     * @param value wire name such as "review"
     * @return the intent
     * @throws IllegalArgumentException for null or unknown names
     */
    @JsonCreator
    public static IntentType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Intent must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IntentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown intent: " + value);
    }
}

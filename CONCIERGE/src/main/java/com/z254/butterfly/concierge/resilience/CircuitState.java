package com.z254.butterfly.concierge.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    CLOSED(0),      // Normal routing
    OPEN(2),        // Routing refused
    HALF_OPEN(1);   // One probe allowed

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /**
     * Numeric value reported by the state gauge.
     */
    public int getGaugeValue() {
        return gaugeValue;
    }
}

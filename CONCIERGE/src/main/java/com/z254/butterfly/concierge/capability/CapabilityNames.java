package com.z254.butterfly.concierge.capability;

import java.util.List;

/**
 * Registry keys of the known capabilities.
 */
public final class CapabilityNames {

    public static final String RECOMMENDATION = "recommendation";
    public static final String REVIEW = "review";
    public static final String PRICE = "price";
    public static final String POLICY = "policy";
    public static final String GENERAL = "general";

    public static final List<String> ALL = List.of(RECOMMENDATION, REVIEW, PRICE, POLICY, GENERAL);

    private CapabilityNames() {
    }
}

package com.z254.butterfly.concierge.intent;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of classifying one query. Immutable and scoped to a single request.
 */
@Value
@Builder
public class IntentResult {

    IntentType intent;

    /**
     * Confidence in [0, 1].
     */
    double confidence;

    String reasoning;

    // Optional hints extracted from the query
    String productName;
    String category;
    BigDecimal minPrice;
    BigDecimal maxPrice;

    /**
     * Result used whenever classification cannot produce an answer.
     *
     * @param description what went wrong
     * @return GENERAL with zero confidence
     */
    public static IntentResult fallback(String description) {
        return IntentResult.builder()
                .intent(IntentType.GENERAL)
                .confidence(0.0)
                .reasoning("Classification failed: " + description)
                .build();
    }

    /**
     * Hints that capabilities understand, keyed by their wire names.
     *
     * A blank category or a zero price carries no constraint and is left out.
     *
     * @return map with any of category, min_price and max_price; empty when none were extracted
     */
    public Map<String, Object> structuredHints() {
        Map<String, Object> hints = new LinkedHashMap<>();
        if (category != null && !category.isBlank()) {
            hints.put("category", category);
        }
        if (isPositive(minPrice)) {
            hints.put("min_price", minPrice);
        }
        if (isPositive(maxPrice)) {
            hints.put("max_price", maxPrice);
        }
        return hints;
    }

    private static boolean isPositive(BigDecimal price) {
        return price != null && price.signum() > 0;
    }

    /**
     * Non-null extracted entities, as returned to API callers.
     */
    public Map<String, Object> entities() {
        Map<String, Object> entities = new LinkedHashMap<>();
        if (productName != null) {
            entities.put("product_name", productName);
        }
        entities.putAll(structuredHints());
        return entities;
    }
}

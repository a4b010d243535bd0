package com.z254.butterfly.concierge.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.concierge.llm.LLMProvider;
import com.z254.butterfly.concierge.llm.LLMRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

/**
 * Intent resolver backed by an LLM in JSON mode.
 * Any failure (transport, malformed JSON, unknown intent) yields {@link IntentResult#fallback(String)}.
 */
@Component
@Slf4j
public class LLMIntentResolver implements IntentResolver {

    static final String CLASSIFIER_PROMPT = """
            You route requests for an online shopping assistant. Pick exactly one intent:
            - recommendation: the user wants product suggestions ("laptops under $800")
            - comparison: the user wants two or more products compared ("iPhone vs Samsung")
            - review: the user asks what customers think ("what do reviews say about X?")
            - policy: the user asks about store rules ("what is the return policy?")
            - price: the user wants prices across retailers ("best price for Galaxy S24?")
            - general: anything else, including greetings and questions about the service

            Also extract, when present: product_name, category, min_price and max_price (USD numbers).

            Answer with a single JSON object with the fields intent, confidence (0 to 1),
            product_name, category, min_price, max_price and reasoning (one sentence).
            Use null for anything not mentioned.
            """;

    private final LLMProvider llmProvider;
    private final ObjectMapper objectMapper;

    public LLMIntentResolver(LLMProvider llmProvider, ObjectMapper objectMapper) {
        this.llmProvider = llmProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<IntentResult> classify(String query) {
        LLMRequest request = LLMRequest.builder()
                .messages(List.of(
                        LLMRequest.systemMessage(CLASSIFIER_PROMPT),
                        LLMRequest.userMessage(query)))
                .temperature(0.0)
                .responseFormat(LLMRequest.jsonObject())
                .build();

        return Mono.defer(() -> llmProvider.complete(request))
                .map(response -> parse(response.getContent()))
                .doOnNext(result -> log.info("Intent: '{}' -> {} ({})",
                        abbreviate(query), result.getIntent().getValue(),
                        String.format("%.2f", result.getConfidence())))
                .switchIfEmpty(Mono.error(new IllegalStateException("empty completion")))
                .onErrorResume(e -> {
                    log.error("Intent classification failed, defaulting to GENERAL: {}", e.getMessage());
                    return Mono.just(IntentResult.fallback(String.valueOf(e.getMessage())));
                });
    }

    IntentResult parse(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("empty completion");
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("malformed classifier output: " + e.getOriginalMessage(), e);
        }

        IntentType intent = IntentType.fromValue(json.path("intent").asText(null));
        double confidence = Math.max(0.0, Math.min(1.0, json.path("confidence").asDouble(0.0)));

        return IntentResult.builder()
                .intent(intent)
                .confidence(confidence)
                .reasoning(json.path("reasoning").asText(""))
                .productName(text(json, "product_name"))
                .category(text(json, "category"))
                .minPrice(price(json, "min_price"))
                .maxPrice(price(json, "max_price"))
                .build();
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    private static BigDecimal price(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}: {}", field, node.asText());
            return null;
        }
    }

    private static String abbreviate(String query) {
        return query.length() > 60 ? query.substring(0, 60) : query;
    }
}

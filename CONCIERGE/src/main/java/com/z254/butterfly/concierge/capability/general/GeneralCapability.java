package com.z254.butterfly.concierge.capability.general;

import com.z254.butterfly.concierge.cache.ExpiringCache;
import com.z254.butterfly.concierge.capability.Capability;
import com.z254.butterfly.concierge.capability.CapabilityNames;
import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.llm.LLMProvider;
import com.z254.butterfly.concierge.llm.LLMRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catch-all capability. Gives a short answer and steers the user toward what the assistant can do.
 * <p>
 * Never reports failure: when the LLM is unreachable it answers with {@link #FALLBACK_ANSWER}.
 * LLM answers are memoized in the result cache under {@code general:<normalized query>}.
 */
@Component
@Slf4j
public class GeneralCapability implements Capability {

    public static final String AGENT_NAME = "general-agent";

    static final String FALLBACK_ANSWER = "I'm here to help with product recommendations, reviews, "
            + "price comparisons, and store policies. What can I help you with?";

    static final String GENERAL_PROMPT = """
            You are the shopping assistant of an online store. When a question cannot be answered
            from product data, reply briefly and point the user to what you can do: product search,
            recommendations, customer reviews, price comparison across retailers and store policies.
            Reply in two or three sentences of plain text.
            """;

    private static final String CACHE_KEY_PREFIX = "general:";

    private final LLMProvider llmProvider;
    private final ExpiringCache resultCache;

    public GeneralCapability(LLMProvider llmProvider, @Qualifier("resultCache") ExpiringCache resultCache) {
        this.llmProvider = llmProvider;
        this.resultCache = resultCache;
    }

    @Override
    public String getName() {
        return CapabilityNames.GENERAL;
    }

    @Override
    public Mono<CapabilityResponse> process(String query, Map<String, Object> context) {
        String cacheKey = CACHE_KEY_PREFIX + normalize(query);

        return Mono.fromCallable(() -> resultCache.get(cacheKey, String.class))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Result cache read failed for {}: {}", cacheKey, e.getMessage());
                    return Mono.just(Optional.empty());
                })
                .flatMap(cached -> cached
                        .map(hit -> Mono.just(answer(hit, true)))
                        .orElseGet(() -> askLlm(query, cacheKey)));
    }

    private Mono<CapabilityResponse> askLlm(String query, String cacheKey) {
        LLMRequest request = LLMRequest.builder()
                .messages(List.of(
                        LLMRequest.systemMessage(GENERAL_PROMPT),
                        LLMRequest.userMessage(query)))
                .build();

        return Mono.defer(() -> llmProvider.complete(request))
                .map(response -> Optional.ofNullable(response.getContent())
                        .map(String::trim)
                        .filter(content -> !content.isEmpty())
                        .orElseThrow(() -> new IllegalStateException("empty completion")))
                .onErrorResume(e -> {
                    log.error("GeneralCapability failed, using canned answer: {}", e.getMessage());
                    return Mono.just(FALLBACK_ANSWER);
                })
                .flatMap(text -> FALLBACK_ANSWER.equals(text)
                        ? Mono.just(answer(text, false))
                        : remember(cacheKey, text).thenReturn(answer(text, false)));
    }

    private Mono<Void> remember(String cacheKey, String answer) {
        return Mono.<Void>fromRunnable(() -> resultCache.set(cacheKey, answer))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Result cache write failed for {}: {}", cacheKey, e.getMessage());
                    return Mono.empty();
                });
    }

    private static CapabilityResponse answer(String answer, boolean cached) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("answer", answer);
        data.put("agent", AGENT_NAME);
        CapabilityResponse response = CapabilityResponse.success(data);
        response.getMetadata().put("cached", cached);
        return response;
    }

    static String normalize(String query) {
        return query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}

package com.z254.butterfly.concierge.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.concierge.config.ConciergeProperties;
import com.z254.butterfly.concierge.llm.LLMProvider;
import com.z254.butterfly.concierge.llm.LLMRequest;
import com.z254.butterfly.concierge.llm.LLMResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OpenAI chat-completions provider.
 */
@Component
@Slf4j
public class OpenAIProvider implements LLMProvider {

    private static final String PROVIDER_ID = "openai";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final ConciergeProperties.LLMProperties.OpenAIProperties config;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    public OpenAIProvider(
            ConciergeProperties conciergeProperties,
            WebClient.Builder webClientBuilder,
            MeterRegistry meterRegistry) {
        this.config = conciergeProperties.getLlm().getOpenai();

        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.llmCallTimer = Timer.builder("concierge.llm.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("concierge.llm.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("concierge.llm.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getDefaultModel() {
        return config.getModel();
    }

    @Override
    @CircuitBreaker(name = "openai")
    @Retry(name = "llm")
    public Mono<LLMResponse> complete(LLMRequest request) {
        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = buildRequestBody(request);

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(this::parseResponse)
                .doOnSuccess(response -> {
                    long duration = System.currentTimeMillis() - startTime;
                    llmCallTimer.record(Duration.ofMillis(duration));
                    log.debug("OpenAI completion: {}ms, {} tokens", duration,
                            response != null ? response.getTotalTokens() : 0);
                })
                .doOnError(e -> {
                    llmErrorCounter.increment();
                    log.error("OpenAI completion error: {}", e.getMessage());
                });
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();

        body.put("model", request.getModel() != null ? request.getModel() : config.getModel());

        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(this::convertMessage)
                .collect(Collectors.toList());
        body.put("messages", messages);

        body.put("temperature", request.getTemperature() != null
                ? request.getTemperature()
                : config.getTemperature());
        body.put("max_tokens", request.getMaxTokens() != null
                ? request.getMaxTokens()
                : config.getMaxTokens());

        if (request.getResponseFormat() != null) {
            body.put("response_format", Map.of("type", request.getResponseFormat().getType()));
        }

        return body;
    }

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        Map<String, Object> msg = new HashMap<>();
        msg.put("role", message.getRole());
        if (message.getContent() != null) {
            msg.put("content", message.getContent());
        }
        return msg;
    }

    private LLMResponse parseResponse(JsonNode json) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode message = choice.path("message");

        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        LLMResponse.Usage usage = null;
        if (json.has("usage")) {
            JsonNode usageNode = json.get("usage");
            usage = LLMResponse.Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt())
                    .completionTokens(usageNode.path("completion_tokens").asInt())
                    .totalTokens(usageNode.path("total_tokens").asInt())
                    .build();
        }

        return LLMResponse.builder()
                .model(json.path("model").asText(config.getModel()))
                .providerId(PROVIDER_ID)
                .content(content)
                .finishReason(parseFinishReason(choice.path("finish_reason").asText("stop")))
                .usage(usage)
                .build();
    }

    private LLMResponse.FinishReason parseFinishReason(String reason) {
        return switch (reason) {
            case "length" -> LLMResponse.FinishReason.LENGTH;
            case "content_filter" -> LLMResponse.FinishReason.CONTENT_FILTER;
            default -> LLMResponse.FinishReason.STOP;
        };
    }
}

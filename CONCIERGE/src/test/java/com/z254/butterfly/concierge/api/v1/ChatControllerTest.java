package com.z254.butterfly.concierge.api.v1;

import com.z254.butterfly.concierge.api.GlobalExceptionHandler;
import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.chat.ChatService;
import com.z254.butterfly.concierge.chat.ChatTurn;
import com.z254.butterfly.concierge.intent.IntentResult;
import com.z254.butterfly.concierge.intent.IntentType;
import com.z254.butterfly.concierge.orchestration.OrchestrationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link ChatController}.
 */
@WebFluxTest(controllers = ChatController.class)
@Import(GlobalExceptionHandler.class)
class ChatControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ChatService chatService;

    private static ChatTurn turn() {
        IntentResult intent = IntentResult.builder()
                .intent(IntentType.RECOMMENDATION)
                .confidence(0.91)
                .reasoning("wants laptops")
                .category("laptops")
                .maxPrice(new BigDecimal("800"))
                .build();
        OrchestrationResult result = OrchestrationResult.builder()
                .intent(intent)
                .response(CapabilityResponse.success(Map.of("answer", "Try these", "agent", "general-agent")))
                .capabilityKey("general")
                .build();
        return ChatTurn.builder().sessionId("s-1").message("find laptops under $800").result(result).build();
    }

    @Nested
    @DisplayName("POST /api/v1/chat")
    class SendMessageTests {

        @Test
        @DisplayName("should answer a valid message")
        void answersMessage() {
            when(chatService.chat(anyString(), isNull(), anyInt())).thenReturn(Mono.just(turn()));

            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "find laptops under $800"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.sessionId").isEqualTo("s-1")
                    .jsonPath("$.intent").isEqualTo("recommendation")
                    .jsonPath("$.confidence").isEqualTo(0.91)
                    .jsonPath("$.entities.category").isEqualTo("laptops")
                    .jsonPath("$.agentUsed").isEqualTo("general-agent")
                    .jsonPath("$.response.answer").isEqualTo("Try these")
                    .jsonPath("$.success").isEqualTo(true);

            verify(chatService).chat(eq("find laptops under $800"), isNull(), eq(5));
        }

        @Test
        @DisplayName("should pass session and result limit through")
        void passesSessionAndLimit() {
            when(chatService.chat(anyString(), anyString(), anyInt())).thenReturn(Mono.just(turn()));

            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "cheaper ones?", "sessionId", "s-1", "maxResults", 3))
                    .exchange()
                    .expectStatus().isOk();

            verify(chatService).chat("cheaper ones?", "s-1", 3);
        }

        @Test
        @DisplayName("should reject a blank message")
        void rejectsBlankMessage() {
            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "  "))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.title").isEqualTo("Validation failed")
                    .jsonPath("$.detail").isEqualTo("Message is required");

            verifyNoInteractions(chatService);
        }

        @Test
        @DisplayName("should reject a message over 1000 characters")
        void rejectsLongMessage() {
            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "x".repeat(1001)))
                    .exchange()
                    .expectStatus().isBadRequest();

            verifyNoInteractions(chatService);
        }

        @Test
        @DisplayName("should reject a result limit above 20")
        void rejectsLargeLimit() {
            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "laptops", "maxResults", 21))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.detail").isEqualTo("maxResults must be at most 20");
        }

        @Test
        @DisplayName("should map unexpected errors to 500")
        void unexpectedError() {
            when(chatService.chat(anyString(), isNull(), anyInt()))
                    .thenReturn(Mono.error(new IllegalStateException("redis gone")));

            webTestClient.post()
                    .uri("/api/v1/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", "hello"))
                    .exchange()
                    .expectStatus().is5xxServerError()
                    .expectBody()
                    .jsonPath("$.title").isEqualTo("Unexpected error");
        }
    }
}

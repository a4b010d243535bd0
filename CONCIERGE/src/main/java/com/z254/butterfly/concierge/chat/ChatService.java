package com.z254.butterfly.concierge.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.concierge.capability.CapabilityResponse;
import com.z254.butterfly.concierge.orchestration.Orchestrator;
import com.z254.butterfly.concierge.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * Answers chat messages within a session.
 * <p>
 * The query sent to the orchestrator is enriched with the session transcript; the transcript
 * records the raw message and a plain-text rendering of the answer.
 */
@Service
@Slf4j
public class ChatService {

    private final Orchestrator orchestrator;
    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public ChatService(Orchestrator orchestrator, SessionManager sessionManager, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
    }

    /**
     * Answer one message.
     *
     * @param message the user message
     * @param sessionId existing session, or null to start a new one
     * @param maxResults result limit passed to capabilities
     * @return the answered turn
     */
    public Mono<ChatTurn> chat(String message, String sessionId, int maxResults) {
        return Mono.fromCallable(() -> sessionId == null || sessionId.isBlank()
                        ? sessionManager.createSession()
                        : sessionId)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(id -> Mono.fromCallable(() -> sessionManager.getHistory(id))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(history -> {
                            Map<String, Object> context = new HashMap<>();
                            context.put("max_results", maxResults);
                            context.put("session_id", id);
                            log.info("Chat message in session {} ({} prior messages)", id, history.size());
                            return orchestrator.handle(SessionManager.buildEnrichedQuery(message, history), context);
                        })
                        .flatMap(result -> Mono.fromRunnable(() -> sessionManager.appendTurn(
                                        id, message, assistantText(result.getResponse())))
                                .subscribeOn(Schedulers.boundedElastic())
                                .thenReturn(ChatTurn.builder()
                                        .sessionId(id)
                                        .message(message)
                                        .result(result)
                                        .build())));
    }

    /**
     * Text stored in the transcript for an answer.
     */
    String assistantText(CapabilityResponse response) {
        Map<String, Object> data = response.getData();
        for (String field : new String[]{"answer", "message"}) {
            Object value = data.get(field);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        if (!response.isSuccess() && response.getError() != null) {
            return response.getError();
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.debug("Answer data is not JSON-serializable: {}", e.getMessage());
            return String.valueOf(data);
        }
    }
}

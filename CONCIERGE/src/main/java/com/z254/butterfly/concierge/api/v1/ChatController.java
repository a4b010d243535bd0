package com.z254.butterfly.concierge.api.v1;

import com.z254.butterfly.concierge.api.dto.ChatRequest;
import com.z254.butterfly.concierge.api.dto.ChatResponse;
import com.z254.butterfly.concierge.chat.ChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for chat operations.
 */
@RestController
@RequestMapping("/api/v1/chat")
@Tag(name = "Chat", description = "Intent-routed chat")
@Slf4j
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping
    @Operation(summary = "Send message",
               description = "Classify the message, route it to a capability and record the turn in the session")
    @ApiResponse(responseCode = "200", description = "Response generated")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    public Mono<ResponseEntity<ChatResponse>> sendMessage(@Valid @RequestBody ChatRequest request) {
        log.debug("Chat message (session={}, maxResults={})", request.getSessionId(), request.getMaxResults());

        return chatService.chat(request.getMessage(), request.getSessionId(), request.getMaxResults())
                .map(ChatResponse::fromTurn)
                .map(ResponseEntity::ok);
    }
}

package com.z254.butterfly.concierge.api.v1;

import com.z254.butterfly.concierge.api.dto.SessionHistoryResponse;
import com.z254.butterfly.concierge.api.dto.SessionResponse;
import com.z254.butterfly.concierge.session.SessionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for chat sessions.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Sessions", description = "Conversation session management")
@Slf4j
public class SessionController {

    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @PostMapping
    @Operation(summary = "Create session", description = "Start a session with an empty transcript")
    @ApiResponse(responseCode = "201", description = "Session created")
    public Mono<ResponseEntity<SessionResponse>> createSession() {
        return Mono.fromCallable(sessionManager::createSession)
                .subscribeOn(Schedulers.boundedElastic())
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new SessionResponse(id)));
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Get history", description = "Transcript of the session, oldest first")
    @ApiResponse(responseCode = "200", description = "History returned (empty for unknown sessions)")
    public Mono<SessionHistoryResponse> getHistory(
            @Parameter(description = "Session ID") @PathVariable String id) {
        return Mono.fromCallable(() -> SessionHistoryResponse.of(id, sessionManager.getHistory(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Clear session", description = "Empty the transcript of a session")
    @ApiResponse(responseCode = "204", description = "Session cleared")
    @ApiResponse(responseCode = "404", description = "Session not found")
    public Mono<ResponseEntity<Void>> clearSession(
            @Parameter(description = "Session ID") @PathVariable String id) {
        return Mono.fromCallable(() -> sessionManager.exists(id) && sessionManager.clear(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(existed -> {
                    if (!existed) {
                        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
                    }
                    log.info("Session cleared: {}", id);
                    return ResponseEntity.noContent().<Void>build();
                });
    }
}

package com.z254.butterfly.concierge.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.concierge.cache.ExpiringCache;
import com.z254.butterfly.concierge.config.ConciergeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps a bounded transcript per session in the session cache.
 * <p>
 * Only the last {@code maxPairs} user/assistant pairs are kept. Appends are read-modify-write
 * without per-session locking, so two concurrent appends to one session keep the last write.
 */
@Component
@Slf4j
public class SessionManager {

    static final String HISTORY_MARKER = "[CONVERSATION HISTORY]";
    static final String QUERY_MARKER = "[CURRENT QUERY]";

    private static final TypeReference<List<ChatMessage>> TRANSCRIPT = new TypeReference<>() {
    };

    private final ExpiringCache sessionCache;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final int maxPairs;

    public SessionManager(@Qualifier("sessionCache") ExpiringCache sessionCache,
                          ObjectMapper objectMapper,
                          ConciergeProperties conciergeProperties,
                          Clock conciergeClock) {
        this.sessionCache = sessionCache;
        this.objectMapper = objectMapper;
        this.clock = conciergeClock;
        this.ttl = conciergeProperties.getSession().getTtl();
        this.maxPairs = conciergeProperties.getSession().getMaxPairs();
        if (maxPairs < 1) {
            throw new IllegalArgumentException("Session maxPairs must be at least 1: " + maxPairs);
        }
    }

    /**
     * Start a new session with an empty transcript.
     *
     * @return the new session id
     */
    public String createSession() {
        String sessionId = UUID.randomUUID().toString();
        sessionCache.set(sessionId, new ArrayList<ChatMessage>(), ttl);
        log.debug("Session created: {}", sessionId);
        return sessionId;
    }

    /**
     * @param sessionId session id
     * @return the transcript, oldest first; empty when the session is unknown or its payload is corrupt
     */
    public List<ChatMessage> getHistory(String sessionId) {
        return read(sessionId).orElse(Collections.emptyList());
    }

    /**
     * @return true if a transcript is stored for the session, even an empty one
     */
    public boolean exists(String sessionId) {
        return sessionCache.get(sessionId).isPresent();
    }

    /**
     * Append one user/assistant exchange, keeping only the most recent pairs.
     */
    public void appendTurn(String sessionId, String userMessage, String assistantMessage) {
        List<ChatMessage> transcript = new ArrayList<>(getHistory(sessionId));
        transcript.add(message(ChatMessage.ROLE_USER, userMessage));
        transcript.add(message(ChatMessage.ROLE_ASSISTANT, assistantMessage));

        int limit = maxPairs * 2;
        if (transcript.size() > limit) {
            transcript = new ArrayList<>(transcript.subList(transcript.size() - limit, transcript.size()));
        }
        sessionCache.set(sessionId, transcript, ttl);
    }

    /**
     * Empty the transcript of a session.
     *
     * @return whether a transcript was stored before the call
     */
    public boolean clear(String sessionId) {
        boolean existed = exists(sessionId);
        sessionCache.set(sessionId, new ArrayList<ChatMessage>(), ttl);
        log.debug("Session cleared: {} (existed={})", sessionId, existed);
        return existed;
    }

    /**
     * Prefix a query with the conversation so far.
     *
     * @param query the current query
     * @param history transcript, oldest first
     * @return the query unchanged when there is no history, the enriched query otherwise
     */
    public static String buildEnrichedQuery(String query, List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return query;
        }
        List<String> lines = new ArrayList<>(history.size() + 3);
        lines.add(HISTORY_MARKER);
        for (ChatMessage message : history) {
            lines.add(message.getRole() + ": " + message.getContent());
        }
        lines.add(QUERY_MARKER);
        lines.add(ChatMessage.ROLE_USER + ": " + query);
        return String.join("\n", lines);
    }

    private Optional<List<ChatMessage>> read(String sessionId) {
        Optional<Object> stored = sessionCache.get(sessionId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            Object raw = stored.get();
            List<ChatMessage> transcript = raw instanceof String json
                    ? objectMapper.readValue(json, TRANSCRIPT)
                    : objectMapper.convertValue(raw, TRANSCRIPT);
            if (transcript == null) {
                throw new IllegalArgumentException("null transcript");
            }
            for (ChatMessage message : transcript) {
                if (message == null || message.getRole() == null || message.getContent() == null) {
                    throw new IllegalArgumentException("incomplete message");
                }
            }
            return Optional.of(Collections.unmodifiableList(transcript));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Session {}: unreadable transcript ({}), treating as empty", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private ChatMessage message(String role, String content) {
        return ChatMessage.builder()
                .role(role)
                .content(content)
                .timestamp(clock.instant())
                .build();
    }
}

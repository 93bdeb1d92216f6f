package com.printshop_voice_backend.services;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.websocket.ClientConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class VoiceSessionManager {

    private final VoicePipelineProperties properties;
    private final RateLimitingService rateLimitingService;

    private final Map<String, VoiceSession> activeSessions = new ConcurrentHashMap<>();

    /**
     * Create and register the session for a newly opened connection.
     */
    public VoiceSession createSession(ClientConnection connection) {
        VoiceSession session = new VoiceSession(
                connection.getId(),
                connection,
                new AudioBuffer(properties.getMaxAudioChunks()),
                new ConversationHistory(properties.getMaxConversationHistory(), properties.getHistoryTrimSlack()));

        VoiceSession previous = activeSessions.put(session.getSessionId(), session);
        if (previous != null) {
            log.warn("Replacing existing voice session with duplicate id: {}", session.getSessionId());
            previous.release();
        }

        log.info("Created new voice session: {}", session.getSessionId());
        return session;
    }

    public Optional<VoiceSession> findSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    /**
     * Get voice session by ID
     */
    public VoiceSession getSession(String sessionId) {
        VoiceSession session = activeSessions.get(sessionId);
        if (session == null) {
            throw new IllegalArgumentException("Voice session not found: " + sessionId);
        }
        return session;
    }

    /**
     * Remove the session and release everything it holds. Idempotent.
     */
    public void closeSession(String sessionId, String reason) {
        VoiceSession session = activeSessions.remove(sessionId);
        rateLimitingService.releaseSession(sessionId);
        if (session != null && session.release()) {
            log.info("Closed voice session: {} - Reason: {} (turns: {})", sessionId, reason, session.getTurnCount());
        }
    }

    public List<VoiceSession> getActiveSessions() {
        return new ArrayList<>(activeSessions.values());
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    public Map<String, Object> getSessionStatistics() {
        List<VoiceSession> sessions = getActiveSessions();

        return Map.of(
            "activeSessionCount", sessions.size(),
            "processingSessionCount", sessions.stream()
                .filter(VoiceSession::isProcessing)
                .count(),
            "averageTurnsPerSession", sessions.stream()
                .mapToInt(VoiceSession::getTurnCount)
                .average()
                .orElse(0.0),
            "oldestSessionAgeMinutes", sessions.stream()
                .map(s -> Duration.between(s.getCreatedAt(), LocalDateTime.now()).toMinutes())
                .max(Long::compareTo)
                .orElse(0L)
        );
    }
}

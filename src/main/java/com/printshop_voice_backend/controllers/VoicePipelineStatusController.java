package com.printshop_voice_backend.controllers;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.services.RateLimitingService;
import com.printshop_voice_backend.services.VoiceSession;
import com.printshop_voice_backend.services.VoiceSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/voice-pipeline")
@RequiredArgsConstructor
public class VoicePipelineStatusController {

    private final VoiceSessionManager sessionManager;
    private final RateLimitingService rateLimitingService;
    private final VoicePipelineProperties properties;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new HashMap<>(sessionManager.getSessionStatistics());
        status.put("endpoint", properties.getEndpoint());
        status.put("timestamp", LocalDateTime.now());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        VoiceSession session = sessionManager.getSession(sessionId);

        Map<String, Object> details = new HashMap<>();
        details.put("sessionId", session.getSessionId());
        details.put("processing", session.isProcessing());
        details.put("turnCount", session.getTurnCount());
        details.put("bufferedChunks", session.getAudioBuffer().size());
        details.put("historySize", session.getHistory().size());
        details.put("createdAt", session.getCreatedAt());
        details.put("lastActivityAt", session.getLastActivityAt());
        details.put("turnsAvailable", rateLimitingService.getAvailableTurns(sessionId));
        return ResponseEntity.ok(details);
    }
}

package com.printshop_voice_backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketStartupListener {

    private final VoicePipelineProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("=".repeat(60));
        log.info("PRINT SHOP VOICE BACKEND STARTED");
        log.info("Voice pipeline WebSocket: ws://<host>{}", properties.getEndpoint());
        log.info("Status: GET /api/voice-pipeline/status");
        log.info("Limits: {} audio chunks, {} history entries, idle {} ms, processing {} ms",
                properties.getMaxAudioChunks(), properties.getMaxConversationHistory(),
                properties.getSessionTimeoutMs(), properties.getProcessingTimeoutMs());
        log.info("=".repeat(60));
    }
}

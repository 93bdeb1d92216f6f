package com.printshop_voice_backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.dto.PipelineEvent;
import com.printshop_voice_backend.services.AudioBufferManager;
import com.printshop_voice_backend.services.ControlMessageValidator;
import com.printshop_voice_backend.services.ControlMessageValidator.FrameClassification;
import com.printshop_voice_backend.services.SessionTimeoutSupervisor;
import com.printshop_voice_backend.services.VoicePipelineService;
import com.printshop_voice_backend.services.VoiceSession;
import com.printshop_voice_backend.services.VoiceSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Entry point of the voice channel. Text and binary frames are classified the same way:
 * control JSON goes to the pipeline, anything else is recorded audio.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VoicePipelineWebSocketHandler extends AbstractWebSocketHandler {

    public static final int INTERNAL_ERROR_CLOSE_CODE = 1011;
    public static final String INTERNAL_ERROR_REASON = "Internal error";

    private final VoiceSessionManager sessionManager;
    private final SessionTimeoutSupervisor sessionTimeoutSupervisor;
    private final ControlMessageValidator controlMessageValidator;
    private final AudioBufferManager audioBufferManager;
    private final VoicePipelineService voicePipelineService;
    private final VoicePipelineProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
        ClientConnection connection = new WebSocketClientConnection(concurrentSession, objectMapper);

        VoiceSession voiceSession = sessionManager.createSession(connection);
        sessionTimeoutSupervisor.arm(voiceSession);
        connection.send(PipelineEvent.connected());

        log.info("Voice pipeline connection established: {} from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        handleFrame(session, message.asBytes());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ByteBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        handleFrame(session, bytes);
    }

    private void handleFrame(WebSocketSession session, byte[] payload) {
        Optional<VoiceSession> found = sessionManager.findSession(session.getId());
        if (found.isEmpty()) {
            log.warn("Frame for unknown voice session {}, ignoring", session.getId());
            return;
        }

        VoiceSession voiceSession = found.get();
        sessionTimeoutSupervisor.arm(voiceSession);

        FrameClassification frame = controlMessageValidator.classify(payload);
        switch (frame.getKind()) {
            case CONTROL -> voicePipelineService.handleControl(voiceSession, frame.getControlMessage());
            case INVALID -> voiceSession.getConnection().send(PipelineEvent.error(ControlMessageValidator.INVALID_MESSAGE));
            case AUDIO -> {
                if (frame.getAudio().length > 0) {
                    audioBufferManager.accept(voiceSession, frame.getAudio());
                }
            }
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Voice pipeline transport error for session {}", session.getId(), exception);

        sessionManager.findSession(session.getId()).ifPresent(voiceSession -> {
            voiceSession.getConnection().send(PipelineEvent.error(INTERNAL_ERROR_REASON));
            voiceSession.getConnection().close(INTERNAL_ERROR_CLOSE_CODE, INTERNAL_ERROR_REASON);
        });
        sessionManager.closeSession(session.getId(), "Transport error: " + exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionManager.closeSession(session.getId(), "Connection closed (" + status.getCode() + ")");
    }
}

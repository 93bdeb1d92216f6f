package com.printshop_voice_backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.printshop_voice_backend.dto.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientConnection} over a Spring WebSocket session. The session is expected to be a
 * {@code ConcurrentWebSocketSessionDecorator} so worker, timer and handler threads can all send.
 */
@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketClientConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean send(PipelineEvent event) {
        if (!isOpen()) {
            log.debug("Not sending {} to closed session {}", event.getType(), getId());
            return false;
        }

        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Could not serialise {} event for session {}", event.getType(), getId(), e);
            return false;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send {} to session {}: {}", event.getType(), getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (session.isOpen()) {
                session.close(new CloseStatus(code, reason));
            }
        } catch (IOException e) {
            log.warn("Error closing session {}: {}", getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }
}

package com.printshop_voice_backend.config;

import com.printshop_voice_backend.websocket.VoicePipelineWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final VoicePipelineWebSocketHandler voicePipelineWebSocketHandler;
    private final VoicePipelineProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Raw WebSocket endpoint for the voice pipeline (audio frames are binary)
        registry.addHandler(voicePipelineWebSocketHandler, properties.getEndpoint())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(64 * 1024);
        container.setMaxBinaryMessageBufferSize(properties.getMaxBinaryMessageBytes());
        container.setAsyncSendTimeout((long) properties.getSendTimeLimitMs());
        return container;
    }
}

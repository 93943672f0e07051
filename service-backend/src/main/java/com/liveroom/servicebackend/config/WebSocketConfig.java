package com.liveroom.servicebackend.config;

import com.liveroom.servicebackend.webrtc.WebRTCSignalingHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for room signaling.
 *
 * Clients connect with:
 * ws://host:port/ws/signaling?roomId=r1&participantId=alice&role=TUTOR
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // an SDP with many candidates stays well below this
    private static final int MAX_TEXT_MESSAGE_SIZE = 64 * 1024;

    private final WebRTCSignalingHandler webRTCSignalingHandler;
    private final CorsProperties corsProperties;

    public WebSocketConfig(WebRTCSignalingHandler webRTCSignalingHandler, CorsProperties corsProperties) {
        this.webRTCSignalingHandler = webRTCSignalingHandler;
        this.corsProperties = corsProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webRTCSignalingHandler, "/ws/signaling")
                .setAllowedOriginPatterns(corsProperties.originPatterns());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_SIZE);
        return container;
    }
}

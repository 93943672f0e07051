package com.liveroom.servicebackend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the REST endpoints. The signaling WebSocket applies the same origins in
 * {@link WebSocketConfig}.
 */
@Configuration
@EnableConfigurationProperties(CorsProperties.class)
public class CorsConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;

    public CorsConfig(CorsProperties corsProperties) {
        this.corsProperties = corsProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/rooms/**")
                .allowedOriginPatterns(corsProperties.originPatterns())
                .allowedMethods("GET", "POST", "DELETE")
                .allowedHeaders("Content-Type")
                .maxAge(corsProperties.preflightMaxAge().toSeconds());
        registry.addMapping("/api/webrtc/**")
                .allowedOriginPatterns(corsProperties.originPatterns())
                .allowedMethods("GET")
                .maxAge(corsProperties.preflightMaxAge().toSeconds());
        registry.addMapping("/api/health")
                .allowedOriginPatterns("*")
                .allowedMethods("GET");
    }
}

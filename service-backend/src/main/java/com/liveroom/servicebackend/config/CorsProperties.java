package com.liveroom.servicebackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Browser origins allowed to call the room API and open the signaling WebSocket.
 *
 * @param allowedOrigins origin patterns, wildcards as accepted by
 *                       {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}
 * @param preflightMaxAge how long browsers may cache a preflight answer
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(
        @DefaultValue({"http://localhost:*", "http://127.0.0.1:*"}) List<String> allowedOrigins,
        @DefaultValue("30m") Duration preflightMaxAge) {

    public String[] originPatterns() {
        return allowedOrigins.toArray(String[]::new);
    }
}

package com.liveroom.servicebackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "call")
public record CallProperties(
        @DefaultValue Rooms rooms,
        @DefaultValue Negotiation negotiation,
        @DefaultValue Ice ice,
        @DefaultValue Admission admission,
        @DefaultValue Signaling signaling,
        @DefaultValue("30s") Duration deviceTimeout) {

    public static CallProperties defaults() {
        return new CallProperties(
                new Rooms(2, true, Duration.ofMinutes(10)),
                new Negotiation(Duration.ofSeconds(15), Duration.ofSeconds(2), 1),
                new Ice(null, List.of("stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302")),
                new Admission(null, Duration.ofSeconds(5)),
                new Signaling(Duration.ofSeconds(10), Duration.ofMillis(250)),
                Duration.ofSeconds(30));
    }

    /**
     * @param defaultCapacity capacity of rooms created on first join
     * @param autoCreate      whether joining an unknown room creates it
     * @param retention       how long ended rooms stay visible to status lookups
     */
    public record Rooms(
            @DefaultValue("2") int defaultCapacity,
            @DefaultValue("true") boolean autoCreate,
            @DefaultValue("10m") Duration retention) {
    }

    /**
     * @param timeout      time allowed from an offer to transport connectivity
     * @param retryBackoff delay before an ICE restart after a failure
     * @param maxRestarts  ICE restarts attempted before the call is given up
     */
    public record Negotiation(
            @DefaultValue("15s") Duration timeout,
            @DefaultValue("2s") Duration retryBackoff,
            @DefaultValue("1") int maxRestarts) {
    }

    /**
     * @param configUrl        endpoint returning the current STUN/TURN entries; fallback only when absent
     * @param fallbackStunUrls used when the endpoint is absent or unreachable
     */
    public record Ice(
            String configUrl,
            @DefaultValue({"stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302"}) List<String> fallbackStunUrls) {
    }

    /**
     * @param baseUrl scheduling service base URL; rooms are admitted directly when absent
     */
    public record Admission(
            String baseUrl,
            @DefaultValue("5s") Duration timeout) {
    }

    /**
     * @param reconnectGrace how long a dropped WebSocket participant keeps its seat
     * @param pollInterval   wake-up interval of subscription pumps
     */
    public record Signaling(
            @DefaultValue("10s") Duration reconnectGrace,
            @DefaultValue("250ms") Duration pollInterval) {
    }
}

package com.liveroom.servicebackend.ice;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveroom.servicebackend.config.CallProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Supplies STUN/TURN entries for a join.
 *
 * TURN credentials are short-lived, so every call goes back to the configuration
 * endpoint; nothing is cached. When the endpoint is not configured, unreachable or
 * returns nothing usable, the configured public STUN servers are used instead.
 */
public class IceConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(IceConfigProvider.class);
    private static final TypeReference<List<IceServer>> ICE_SERVER_LIST = new TypeReference<>() {
    };

    private final CallProperties.Ice settings;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public IceConfigProvider(CallProperties.Ice settings, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.settings = settings;
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    public List<IceServer> fetchIceServers() {
        String configUrl = settings.configUrl();
        if (configUrl == null || configUrl.isBlank()) {
            return fallback();
        }

        try {
            JsonNode body = restClient.get()
                    .uri(configUrl)
                    .retrieve()
                    .body(JsonNode.class);
            List<IceServer> servers = parse(body);
            if (servers.isEmpty()) {
                log.warn("ICE configuration endpoint returned no servers, using fallback STUN");
                return fallback();
            }
            log.debug("Fetched {} ICE servers ({} relay)", servers.size(),
                    servers.stream().filter(IceServer::isRelay).count());
            return servers;
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Failed to fetch ICE configuration from {}: {}", configUrl, e.getMessage());
            return fallback();
        }
    }

    public List<IceServer> fallback() {
        return settings.fallbackStunUrls().stream()
                .map(IceServer::stun)
                .toList();
    }

    private List<IceServer> parse(JsonNode body) {
        if (body == null || body.isNull()) {
            return List.of();
        }
        JsonNode list = body.isArray() ? body : body.path("iceServers");
        if (!list.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(list, ICE_SERVER_LIST).stream()
                .filter(server -> !server.urls().isEmpty())
                .toList();
    }
}

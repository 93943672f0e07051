package com.liveroom.servicebackend.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * Admission through the scheduling service: {@code POST /sessions/{id}/join}.
 * Any non-2xx answer or transport failure denies the join.
 */
public class RestAdmissionGateway implements AdmissionGateway {
    private static final Logger log = LoggerFactory.getLogger(RestAdmissionGateway.class);

    private final RestClient restClient;

    public RestAdmissionGateway(String baseUrl, RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    }

    @Override
    public AdmissionGrant requestJoin(String sessionId, String participantId) {
        AdmissionGrant grant;
        try {
            grant = restClient.post()
                    .uri("/sessions/{id}/join", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("participantId", participantId))
                    .retrieve()
                    .body(AdmissionGrant.class);
        } catch (RestClientResponseException e) {
            log.warn("Admission of {} to session {} denied: HTTP {}",
                    participantId, sessionId, e.getStatusCode().value());
            throw new AdmissionDeniedException("Admission denied with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.warn("Admission service unreachable for session {}: {}", sessionId, e.getMessage());
            throw new AdmissionDeniedException("Admission service unavailable", e);
        }

        if (grant == null || grant.roomId() == null || grant.roomId().isBlank()) {
            throw new AdmissionDeniedException("Admission response did not name a room");
        }
        log.info("Admission granted: participant={}, session={}, room={}", participantId, sessionId, grant.roomId());
        return grant;
    }
}

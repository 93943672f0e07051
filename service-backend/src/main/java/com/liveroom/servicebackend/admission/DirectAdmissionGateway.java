package com.liveroom.servicebackend.admission;

import java.util.List;

/**
 * Admits every request to the room named after the session. Used when no scheduling
 * service is configured; capacity is still enforced by the room registry.
 */
public class DirectAdmissionGateway implements AdmissionGateway {

    @Override
    public AdmissionGrant requestJoin(String sessionId, String participantId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new AdmissionDeniedException("Session id is required");
        }
        return new AdmissionGrant(sessionId, participantId, List.of());
    }
}

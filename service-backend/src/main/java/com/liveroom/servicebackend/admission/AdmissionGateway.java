package com.liveroom.servicebackend.admission;

/**
 * Asks the scheduling side whether a participant may join a session.
 */
public interface AdmissionGateway {

    /**
     * @throws AdmissionDeniedException if the participant may not join
     */
    AdmissionGrant requestJoin(String sessionId, String participantId);
}

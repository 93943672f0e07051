package com.liveroom.servicebackend.admission;

import com.liveroom.servicebackend.ice.IceServer;

import java.util.List;

/**
 * Permission to join: the room to enter and, optionally, ICE servers issued with it.
 */
public record AdmissionGrant(
        String roomId,
        String participantId,
        List<IceServer> iceServers) {

    public AdmissionGrant {
        iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
    }
}

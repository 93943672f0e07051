package com.liveroom.servicebackend.room;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.signaling.SignalingChannel;

import java.util.List;

/**
 * Outcome of {@link RoomRegistry#admit}: the room's channel and roster on success,
 * otherwise the rejection reason.
 */
public record AdmissionResult(
        CallError error,
        String roomId,
        Participant participant,
        SignalingChannel channel,
        List<Participant> roster) {

    public static AdmissionResult admitted(String roomId, Participant participant,
            SignalingChannel channel, List<Participant> roster) {
        return new AdmissionResult(null, roomId, participant, channel, List.copyOf(roster));
    }

    public static AdmissionResult rejected(CallError error, String roomId) {
        return new AdmissionResult(error, roomId, null, null, List.of());
    }

    public boolean isAdmitted() {
        return error == null;
    }
}

package com.liveroom.servicebackend.web.dto;

import com.liveroom.servicebackend.room.Participant;

import java.time.Instant;

public record ParticipantDto(String id, String role, Instant joinedAt) {

    public static ParticipantDto from(Participant participant) {
        return new ParticipantDto(participant.id(), participant.role().name(), participant.joinedAt());
    }
}

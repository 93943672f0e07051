package com.liveroom.servicebackend.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.liveroom.servicebackend.room.Room;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomResponse(
        boolean success,
        String message,
        String roomId,
        String status,
        Integer capacity,
        Instant createdAt,
        Instant endedAt,
        List<ParticipantDto> participants) {

    public static RoomResponse success(Room room) {
        return new RoomResponse(true, null, room.id(), room.status().name(), room.capacity(),
                room.createdAt(), room.endedAt(),
                room.participants().stream().map(ParticipantDto::from).toList());
    }

    public static RoomResponse failure(String message) {
        return new RoomResponse(false, message, null, null, null, null, null, null);
    }
}

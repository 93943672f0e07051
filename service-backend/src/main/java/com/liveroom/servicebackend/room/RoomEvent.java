package com.liveroom.servicebackend.room;

import java.time.Instant;
import java.util.List;

/**
 * Membership change delivered to the members of a room.
 *
 * @param participantId the participant that joined or left; null for {@link Type#ROOM_CLOSED}
 * @param roster        member ids after the change
 */
public record RoomEvent(
        Type type,
        String roomId,
        String participantId,
        List<String> roster,
        Instant timestamp) {

    public enum Type {
        PARTICIPANT_JOINED,
        PARTICIPANT_LEFT,
        ROOM_CLOSED
    }

    public static RoomEvent joined(String roomId, String participantId, List<String> roster) {
        return new RoomEvent(Type.PARTICIPANT_JOINED, roomId, participantId, roster, Instant.now());
    }

    public static RoomEvent left(String roomId, String participantId, List<String> roster) {
        return new RoomEvent(Type.PARTICIPANT_LEFT, roomId, participantId, roster, Instant.now());
    }

    public static RoomEvent closed(String roomId) {
        return new RoomEvent(Type.ROOM_CLOSED, roomId, null, List.of(), Instant.now());
    }
}

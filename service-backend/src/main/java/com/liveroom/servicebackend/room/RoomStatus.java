package com.liveroom.servicebackend.room;

public enum RoomStatus {
    SCHEDULED,
    LIVE,
    ENDED
}

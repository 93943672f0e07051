package com.liveroom.servicebackend.media;

public enum IceConnectionState {
    NEW,
    CHECKING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED
}

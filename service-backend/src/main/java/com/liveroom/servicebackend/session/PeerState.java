package com.liveroom.servicebackend.session;

public enum PeerState {
    IDLE,
    NEGOTIATING,
    CONNECTED,
    RENEGOTIATING,
    FAILED,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}

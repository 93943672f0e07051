package com.liveroom.servicebackend.call;

import com.liveroom.servicebackend.session.CloseReason;
import com.liveroom.servicebackend.session.ConnectionQuality;
import com.liveroom.servicebackend.session.PeerSession;
import com.liveroom.servicebackend.session.PeerState;
import com.liveroom.servicebackend.session.SessionEvent;
import com.liveroom.servicebackend.session.SessionListener;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What a caller holds after a successful join.
 */
public final class SessionHandle {
    private final String roomId;
    private final String participantId;
    private final PeerSession session;

    SessionHandle(String roomId, String participantId, PeerSession session) {
        this.roomId = roomId;
        this.participantId = participantId;
        this.session = session;
    }

    public String roomId() {
        return roomId;
    }

    public String participantId() {
        return participantId;
    }

    public PeerState state() {
        return session.state();
    }

    public ConnectionQuality quality() {
        return session.quality();
    }

    /**
     * Completes once, with the reason the session ended.
     */
    public CompletableFuture<CloseReason> terminated() {
        return session.closed();
    }

    public void addListener(SessionListener listener) {
        session.addListener(listener);
    }

    public List<SessionEvent> trace() {
        return session.trace();
    }

    PeerSession session() {
        return session;
    }

    @Override
    public String toString() {
        return participantId + "@" + roomId + "[" + session.state() + "]";
    }
}

package com.liveroom.servicebackend.room;

import com.liveroom.servicebackend.session.PeerSession;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A member of a room. Holds the participant's current {@link PeerSession} when the
 * session runs in this process; remote participants signaling over WebSocket have none.
 */
public class Participant {
    private final String id;
    private final ParticipantRole role;
    private final Instant joinedAt;
    private volatile PeerSession session;

    public Participant(String id, ParticipantRole role) {
        this(id, role, Instant.now());
    }

    public Participant(String id, ParticipantRole role, Instant joinedAt) {
        this.id = Objects.requireNonNull(id, "participant id must not be null");
        this.role = role != null ? role : ParticipantRole.STUDENT;
        this.joinedAt = joinedAt != null ? joinedAt : Instant.now();
    }

    public String id() {
        return id;
    }

    public ParticipantRole role() {
        return role;
    }

    public Instant joinedAt() {
        return joinedAt;
    }

    public Optional<PeerSession> session() {
        return Optional.ofNullable(session);
    }

    public void attach(PeerSession session) {
        this.session = session;
    }

    public void detach() {
        this.session = null;
    }

    @Override
    public String toString() {
        return id + "(" + role + ")";
    }
}

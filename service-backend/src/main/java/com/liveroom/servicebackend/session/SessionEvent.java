package com.liveroom.servicebackend.session;

import java.time.Instant;

/**
 * Something observable that happened to a {@link PeerSession}.
 *
 * @param from   previous value (state or quality name), or the media kind of a remote
 *               media change; null when not applicable
 * @param to     new value (state, quality name, track id, or enabled/disabled)
 * @param detail human-readable cause
 */
public record SessionEvent(
        Kind kind,
        String participantId,
        String from,
        String to,
        String detail,
        Instant timestamp) {

    public enum Kind {
        STATE_CHANGED,
        TRACK_PUBLISHED,
        TRACK_REPLACED,
        QUALITY_CHANGED,
        REMOTE_MEDIA_CHANGED
    }

    static SessionEvent stateChanged(String participantId, PeerState from, PeerState to, String detail) {
        return new SessionEvent(Kind.STATE_CHANGED, participantId, from.name(), to.name(), detail, Instant.now());
    }

    static SessionEvent trackPublished(String participantId, String trackId, String detail) {
        return new SessionEvent(Kind.TRACK_PUBLISHED, participantId, null, trackId, detail, Instant.now());
    }

    static SessionEvent trackReplaced(String participantId, String previousTrackId, String trackId) {
        return new SessionEvent(Kind.TRACK_REPLACED, participantId, previousTrackId, trackId, "replaced in place", Instant.now());
    }

    static SessionEvent qualityChanged(String participantId, ConnectionQuality from, ConnectionQuality to) {
        return new SessionEvent(Kind.QUALITY_CHANGED, participantId, from.name(), to.name(), null, Instant.now());
    }

    static SessionEvent remoteMediaChanged(String participantId, String peerId, String media, boolean enabled) {
        return new SessionEvent(Kind.REMOTE_MEDIA_CHANGED, participantId, media, enabled ? "enabled" : "disabled",
                "announced by " + peerId, Instant.now());
    }

    public boolean isStateChange(PeerState target) {
        return kind == Kind.STATE_CHANGED && target.name().equals(to);
    }
}

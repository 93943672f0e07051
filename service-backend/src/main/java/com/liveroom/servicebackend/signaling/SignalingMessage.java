package com.liveroom.servicebackend.signaling;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A signaling message in transit between two participants of a room, or broadcast to
 * the room when {@code to} is absent. {@code seq} increases strictly per sender.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignalingMessage(
        SignalingType type,
        long seq,
        String from,
        String to,
        SignalingPayload payload) {

    public SignalingMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(from, "from must not be null");
        if (seq < 0) {
            throw new IllegalArgumentException("seq must not be negative: " + seq);
        }
    }

    public static SignalingMessage offer(String from, String to, long seq, String sdp, boolean iceRestart) {
        return new SignalingMessage(SignalingType.OFFER, seq, from, to, SignalingPayload.description(sdp, iceRestart));
    }

    public static SignalingMessage answer(String from, String to, long seq, String sdp) {
        return new SignalingMessage(SignalingType.ANSWER, seq, from, to, SignalingPayload.description(sdp, false));
    }

    public static SignalingMessage candidate(String from, String to, long seq, String candidate, int sdpMLineIndex) {
        return new SignalingMessage(SignalingType.CANDIDATE, seq, from, to,
                SignalingPayload.candidate(candidate, sdpMLineIndex));
    }

    public static SignalingMessage bye(String from, long seq) {
        return new SignalingMessage(SignalingType.BYE, seq, from, null, null);
    }

    /**
     * Tells the peer that a local camera, microphone or screen share was switched on or off.
     */
    public static SignalingMessage mediaState(String from, String to, long seq, String media, boolean enabled) {
        return new SignalingMessage(SignalingType.MEDIA_STATE, seq, from, to,
                SignalingPayload.mediaState(media, enabled));
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return to == null;
    }

    @JsonIgnore
    public boolean isAddressedTo(String participantId) {
        return to == null || to.equals(participantId);
    }
}

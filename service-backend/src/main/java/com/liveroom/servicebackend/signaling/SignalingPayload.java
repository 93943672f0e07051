package com.liveroom.servicebackend.signaling;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Set;

/**
 * Body of a signaling message. Offers and answers carry {@code sdp}; offers may be
 * flagged as an ICE restart; candidates carry the candidate line and its m-line index.
 * Media-state notices carry {@code media} (video, audio or screen) and {@code enabled}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignalingPayload(
        String sdp,
        Boolean iceRestart,
        String candidate,
        Integer sdpMLineIndex,
        String media,
        Boolean enabled) {

    public static final String MEDIA_VIDEO = "video";
    public static final String MEDIA_AUDIO = "audio";
    public static final String MEDIA_SCREEN = "screen";

    private static final Set<String> MEDIA_KINDS = Set.of(MEDIA_VIDEO, MEDIA_AUDIO, MEDIA_SCREEN);

    public static SignalingPayload description(String sdp, boolean iceRestart) {
        return new SignalingPayload(sdp, iceRestart ? Boolean.TRUE : null, null, null, null, null);
    }

    public static SignalingPayload candidate(String candidate, int sdpMLineIndex) {
        return new SignalingPayload(null, null, candidate, sdpMLineIndex, null, null);
    }

    public static SignalingPayload mediaState(String media, boolean enabled) {
        if (!MEDIA_KINDS.contains(media)) {
            throw new IllegalArgumentException("Unknown media kind: " + media);
        }
        return new SignalingPayload(null, null, null, null, media, enabled);
    }

    @JsonIgnore
    public boolean isMediaState() {
        return media != null && MEDIA_KINDS.contains(media) && enabled != null;
    }

    public boolean restartRequested() {
        return Boolean.TRUE.equals(iceRestart);
    }
}

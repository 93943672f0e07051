package com.liveroom.servicebackend.media;

public enum TrackSource {
    CAMERA(TrackKind.VIDEO),
    MICROPHONE(TrackKind.AUDIO),
    SCREEN(TrackKind.VIDEO);

    private final TrackKind kind;

    TrackSource(TrackKind kind) {
        this.kind = kind;
    }

    public TrackKind kind() {
        return kind;
    }
}

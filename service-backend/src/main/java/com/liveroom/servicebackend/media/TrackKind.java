package com.liveroom.servicebackend.media;

public enum TrackKind {
    AUDIO,
    VIDEO
}

package com.liveroom.servicebackend.media;

/**
 * Opaque handle to a transport sender. A slot keeps its kind for its whole life;
 * the track in it can be swapped without renegotiation.
 */
public record SenderSlot(String id, TrackKind kind) {
}

package com.liveroom.servicebackend.media;

/**
 * Callbacks from a {@link MediaTransport}. May be invoked on any thread.
 */
public interface TransportListener {

    void onLocalCandidate(String candidate, int sdpMLineIndex);

    void onConnectionStateChange(IceConnectionState state);

    default void onStats(TransportStats stats) {
    }
}

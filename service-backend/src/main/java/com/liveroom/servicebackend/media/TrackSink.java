package com.liveroom.servicebackend.media;

/**
 * Receiver of the coordinator's outbound track changes; implemented by the session
 * that owns the transport.
 */
public interface TrackSink {

    /**
     * Adds a new sender for the track. May require renegotiation.
     */
    void publishTrack(Track track);

    /**
     * Moves {@code replacement} into the slot held by {@code current}; never renegotiates.
     */
    void replaceTrack(Track current, Track replacement);

    /**
     * A local source was enabled, disabled, started or stopped by the user.
     */
    void mediaStateChanged(TrackSource source, boolean enabled);
}

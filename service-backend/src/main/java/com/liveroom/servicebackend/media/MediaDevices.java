package com.liveroom.servicebackend.media;

import java.util.concurrent.CompletableFuture;

/**
 * Local capture surface of the platform. Acquisition may prompt the user and stay
 * pending until they answer.
 */
public interface MediaDevices {

    /**
     * @return a future completed with the source, or exceptionally with a
     *         {@link DeviceAcquisitionException}; cancelling the future abandons the request
     */
    CompletableFuture<MediaSource> acquire(TrackSource source);
}

package com.liveroom.servicebackend.media;

/**
 * A captured local media source (camera, microphone or screen) handed out by
 * {@link MediaDevices}.
 */
public interface MediaSource {

    String id();

    TrackSource source();

    /**
     * Starts or stops producing media without releasing the device. A disabled source
     * sends silence or black frames.
     */
    void setEnabled(boolean enabled);

    /**
     * Releases the underlying device. Must be idempotent.
     */
    void stop();

    /**
     * Registers a callback for when the platform ends the capture on its own, for
     * example when the user stops sharing from the browser bar.
     */
    void onEnded(Runnable callback);
}

package com.liveroom.servicebackend.media;

/**
 * An outbound local track. Owned by one {@link MediaTrackCoordinator}; only it mutates
 * the flags.
 */
public final class Track {
    private final MediaSource media;
    private volatile boolean enabled = true;
    private volatile boolean paused;
    private volatile boolean stopped;

    Track(MediaSource media) {
        this.media = media;
    }

    public String id() {
        return media.id();
    }

    public TrackSource source() {
        return media.source();
    }

    public TrackKind kind() {
        return media.source().kind();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * True for the camera while a screen share occupies its slot.
     */
    public boolean isPaused() {
        return paused;
    }

    public boolean isStopped() {
        return stopped;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
        applyToSource();
    }

    void setPaused(boolean paused) {
        this.paused = paused;
        applyToSource();
    }

    private void applyToSource() {
        if (!stopped) {
            media.setEnabled(enabled && !paused);
        }
    }

    void stop() {
        if (!stopped) {
            stopped = true;
            media.stop();
        }
    }

    @Override
    public String toString() {
        return source() + ":" + id() + (enabled ? "" : " (disabled)") + (paused ? " (paused)" : "");
    }
}

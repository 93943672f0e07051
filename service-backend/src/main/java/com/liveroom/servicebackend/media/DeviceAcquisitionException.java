package com.liveroom.servicebackend.media;

/**
 * Raised by {@link MediaDevices} when a capture request cannot be satisfied.
 */
public class DeviceAcquisitionException extends Exception {

    public enum Reason {
        /** No such device, or it is in use elsewhere. */
        UNAVAILABLE,
        /** The user declined the permission prompt or the capture picker. */
        DENIED
    }

    private final TrackSource source;
    private final Reason reason;

    public DeviceAcquisitionException(TrackSource source, Reason reason, String message) {
        super(message);
        this.source = source;
        this.reason = reason;
    }

    public TrackSource source() {
        return source;
    }

    public Reason reason() {
        return reason;
    }
}

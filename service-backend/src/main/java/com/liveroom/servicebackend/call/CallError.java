package com.liveroom.servicebackend.call;

/**
 * Error kinds surfaced by the call core.
 * Admission and device errors are expected, recoverable outcomes returned as values;
 * negotiation errors are retried locally before surfacing as {@link #CALL_FAILED}.
 */
public enum CallError {
    ROOM_FULL,
    ROOM_NOT_FOUND,
    ALREADY_JOINED,
    CHANNEL_CLOSED,
    NEGOTIATION_TIMEOUT,
    ICE_FAILURE,
    DEVICE_UNAVAILABLE,
    USER_CANCELLED_CAPTURE,
    ALREADY_SHARING,
    ADMISSION_DENIED,
    PEER_DISCONNECTED,
    CALL_FAILED,
    SESSION_ENDED
}

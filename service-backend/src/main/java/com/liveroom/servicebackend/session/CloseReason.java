package com.liveroom.servicebackend.session;

import com.liveroom.servicebackend.call.CallError;

/**
 * Why a session closed.
 *
 * @param error the underlying error for {@link Cause#CALL_FAILED} and {@link Cause#PEER_DISCONNECTED}; otherwise null
 */
public record CloseReason(Cause cause, CallError error, String detail) {

    public enum Cause {
        LOCAL_HANGUP,
        PEER_BYE,
        PEER_DISCONNECTED,
        ROOM_ENDED,
        CALL_FAILED
    }

    public static CloseReason localHangup(String detail) {
        return new CloseReason(Cause.LOCAL_HANGUP, null, detail);
    }

    public static CloseReason peerBye(String peerId) {
        return new CloseReason(Cause.PEER_BYE, null, "Peer " + peerId + " hung up");
    }

    public static CloseReason peerDisconnected(String detail) {
        return new CloseReason(Cause.PEER_DISCONNECTED, CallError.PEER_DISCONNECTED, detail);
    }

    public static CloseReason roomEnded(String roomId) {
        return new CloseReason(Cause.ROOM_ENDED, null, "Room " + roomId + " ended");
    }

    public static CloseReason failed(CallError error, String detail) {
        return new CloseReason(Cause.CALL_FAILED, error, detail);
    }

    public boolean isFailure() {
        return cause == Cause.CALL_FAILED;
    }
}

package com.liveroom.servicebackend.media;

/**
 * The peer connection a session negotiates: session descriptions, candidates and
 * sender slots. Implementations wrap the platform's real-time media stack; calls are
 * made from the owning session's serial executor.
 *
 * @throws TransportException from any operation when the underlying stack fails
 */
public interface MediaTransport {

    void setListener(TransportListener listener);

    String createOffer(boolean iceRestart);

    String createAnswer(String remoteOfferSdp);

    void applyAnswer(String remoteAnswerSdp);

    /**
     * Discards an outstanding local offer so a remote offer can be answered instead.
     */
    void rollbackLocalOffer();

    void addRemoteCandidate(String candidate, int sdpMLineIndex);

    /**
     * Adds a sender for the track. The remote side only sees it after the next
     * offer/answer exchange.
     */
    SenderSlot addTrack(Track track);

    /**
     * Swaps the track in an existing slot in place; {@code track} may be null to send
     * nothing on the slot.
     */
    void replaceTrack(SenderSlot slot, Track track);

    void close();
}

package com.liveroom.servicebackend.media;

/**
 * Periodic statistics reported by a transport.
 */
public record TransportStats(long packetsLost, double roundTripTimeMs, double bitrateKbps) {
}

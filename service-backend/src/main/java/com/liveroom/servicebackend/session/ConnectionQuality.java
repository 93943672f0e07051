package com.liveroom.servicebackend.session;

import com.liveroom.servicebackend.media.TransportStats;

/**
 * Coarse rating of the transport from its latest statistics.
 */
public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    UNKNOWN;

    public static ConnectionQuality classify(TransportStats stats) {
        if (stats == null) {
            return UNKNOWN;
        }
        long lost = stats.packetsLost();
        double rtt = stats.roundTripTimeMs();
        double bitrate = stats.bitrateKbps();

        if (lost == 0 && rtt < 50 && bitrate > 500) {
            return EXCELLENT;
        }
        if (lost < 5 && rtt < 100 && bitrate > 250) {
            return GOOD;
        }
        if (lost < 15 && rtt < 200 && bitrate > 100) {
            return FAIR;
        }
        return POOR;
    }
}

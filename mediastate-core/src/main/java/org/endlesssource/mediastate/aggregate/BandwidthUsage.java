package org.endlesssource.mediastate.aggregate;

import java.util.List;

/**
 * Combined bitrate of all active streams.
 * @param megabytesPerSecond Total converted to MB/s, two decimals
 * @param totalBps Total in bits per second
 * @param streams Per-stream contributions
 */
public record BandwidthUsage(double megabytesPerSecond, long totalBps, List<StreamBandwidth> streams) {
    public BandwidthUsage {
        streams = List.copyOf(streams);
    }
}

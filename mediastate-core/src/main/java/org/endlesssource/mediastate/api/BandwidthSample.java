package org.endlesssource.mediastate.api;

/**
 * Bitrate estimate of one session, in bits per second.
 * {@code fallbackBps} is the overall stream bitrate used when no per-track figure is known.
 */
public record BandwidthSample(long videoBps, long audioBps, long fallbackBps) {

    public static final BandwidthSample EMPTY = new BandwidthSample(0L, 0L, 0L);

    public long totalBps() {
        long tracks = videoBps + audioBps;
        return tracks > 0 ? tracks : fallbackBps;
    }
}

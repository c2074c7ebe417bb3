package org.endlesssource.mediastate.aggregate;

/**
 * Bitrate estimate of one active stream, in bits per second.
 */
public record StreamBandwidth(String sessionKey,
                              String user,
                              String device,
                              String media,
                              long videoBps,
                              long audioBps,
                              long totalBps) {
}

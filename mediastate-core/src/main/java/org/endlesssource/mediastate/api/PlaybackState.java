package org.endlesssource.mediastate.api;

/**
 * Playback state enumeration
 */
public enum PlaybackState {
    PLAYING,
    PAUSED,
    IDLE;

    public String id() {
        return name().toLowerCase();
    }
}

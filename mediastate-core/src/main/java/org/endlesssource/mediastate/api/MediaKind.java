package org.endlesssource.mediastate.api;

/**
 * Variant tag of a session's now-playing media.
 */
public enum MediaKind {
    NONE,
    MOVIE,
    EPISODE,
    LIVE_TV
}

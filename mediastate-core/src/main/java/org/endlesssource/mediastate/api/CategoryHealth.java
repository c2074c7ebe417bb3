package org.endlesssource.mediastate.api;

/**
 * Freshness of a category's published state.
 */
public enum CategoryHealth {
    /** Last poll succeeded. */
    OK,
    /** Recent polls failed; previous state retained. */
    STALE,
    /** Failure threshold reached; entities marked unavailable. */
    UNAVAILABLE,
    /** Server rejected the credentials; polling halted until resumed. */
    CONFIG_ERROR,
    /** All toggles feeding the category are off. */
    DISABLED
}

package org.endlesssource.mediastate.api;

/**
 * Toggles for the published aggregates. Session entities are always published.
 */
public enum Feature {
    RECORDINGS(Category.RECORDINGS),
    ACTIVE_STREAMS(Category.SESSIONS),
    MULTISESSION(Category.SESSIONS),
    BANDWIDTH(Category.SESSIONS),
    TRANSCODING_LOAD(Category.SESSIONS),
    SERVER_STATS(Category.SERVER_STATS),
    LIBRARY_STATS(Category.LIBRARY),
    LATEST_MOVIES(Category.LIBRARY),
    LATEST_EPISODES(Category.LIBRARY),
    UPCOMING_EPISODES(Category.LIBRARY);

    private final Category category;

    Feature(Category category) {
        this.category = category;
    }

    /**
     * The poll category that feeds this aggregate.
     */
    public Category category() {
        return category;
    }
}

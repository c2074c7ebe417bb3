package org.endlesssource.mediastate.api;

/**
 * Kinds of externally visible entities produced by the monitor.
 */
public enum EntityKind {
    SESSION("session"),
    ACTIVE_STREAMS("active_streams"),
    MULTISESSION_USERS("multisession_users"),
    BANDWIDTH("bandwidth"),
    TRANSCODING("transcoding"),
    SERVER_STATS("server_stats"),
    RECORDINGS("recordings"),
    LIBRARY_STATS("library_stats"),
    LATEST_MOVIES("latest_movies"),
    LATEST_EPISODES("latest_episodes"),
    UPCOMING_EPISODES("upcoming_episodes");

    private final String id;

    EntityKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

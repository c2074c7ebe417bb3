package org.endlesssource.mediastate.api;

/**
 * Independently polled data categories.
 */
public enum Category {
    SESSIONS("sessions"),
    SERVER_STATS("server_stats"),
    RECORDINGS("recordings"),
    LIBRARY("library");

    private final String id;

    Category(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

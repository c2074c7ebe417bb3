package org.endlesssource.mediastate.api;

/**
 * How a live TV program was resolved.
 */
public enum ProgramSource {
    PROGRAM_ID("program_id"),
    CHANNEL_SEARCH("channel_search"),
    NONE("none");

    private final String id;

    ProgramSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

package org.endlesssource.mediastate.api;

public enum RecordingKind {
    ACTIVE("active"),
    SCHEDULED("scheduled"),
    SERIES("series");

    private final String id;

    RecordingKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

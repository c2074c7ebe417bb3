package org.endlesssource.mediastate.api;

public enum PlaybackMethod {
    DIRECT("direct"),
    TRANSCODING("transcoding");

    private final String id;

    PlaybackMethod(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

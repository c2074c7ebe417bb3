package org.endlesssource.mediastate.api;

/**
 * Session without a now-playing item.
 */
public record NoMedia() implements MediaVariant {

    public static final NoMedia INSTANCE = new NoMedia();

    @Override
    public MediaKind kind() {
        return MediaKind.NONE;
    }
}

package org.endlesssource.mediastate.api;

import java.time.Duration;

/**
 * Movie, and any other playable item that is neither an episode nor live TV.
 * Nullable components are unknown values.
 */
public record Movie(String title,
                    String contentId,
                    Duration duration,
                    Duration position,
                    String posterUrl) implements MediaVariant {

    @Override
    public MediaKind kind() {
        return MediaKind.MOVIE;
    }
}

package org.endlesssource.mediastate.api;

import java.time.Duration;

/**
 * Episode of a series. Nullable components are unknown values.
 */
public record Episode(String title,
                      String seriesTitle,
                      Integer season,
                      Integer episode,
                      String contentId,
                      Duration duration,
                      Duration position,
                      String posterUrl) implements MediaVariant {

    @Override
    public MediaKind kind() {
        return MediaKind.EPISODE;
    }
}

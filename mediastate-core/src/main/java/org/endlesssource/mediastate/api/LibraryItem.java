package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Compact summary of a library item for the latest/upcoming lists.
 */
public record LibraryItem(String id,
                          String type,
                          String title,
                          String seriesTitle,
                          Integer season,
                          Integer episode,
                          Instant premiereDate,
                          Duration runtime,
                          Double rating,
                          List<String> genres,
                          String imageUrl) {
    public LibraryItem {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}

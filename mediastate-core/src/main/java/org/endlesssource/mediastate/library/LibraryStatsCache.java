package org.endlesssource.mediastate.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Fetcher;
import org.endlesssource.mediastate.api.LibraryStats;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.raw.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caches library-wide counts. A failed refresh leaves the cached values and
 * their timestamp untouched.
 */
public final class LibraryStatsCache {
    private static final Logger logger = LoggerFactory.getLogger(LibraryStatsCache.class);

    /** Published count name to payload field, in publishing order. */
    static final Map<String, String> COUNT_FIELDS;

    static {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("movies", "MovieCount");
        fields.put("series", "SeriesCount");
        fields.put("episodes", "EpisodeCount");
        fields.put("songs", "SongCount");
        fields.put("albums", "AlbumCount");
        fields.put("artists", "ArtistCount");
        fields.put("music_videos", "MusicVideoCount");
        fields.put("books", "BookCount");
        fields.put("audiobooks", "AudioBookCount");
        fields.put("trailers", "TrailerCount");
        fields.put("box_sets", "BoxSetCount");
        fields.put("playlists", "PlaylistCount");
        COUNT_FIELDS = Collections.unmodifiableMap(fields);
    }

    private final Fetcher fetcher;
    private final Clock clock;
    private volatile LibraryStats cached;

    public LibraryStatsCache(Fetcher fetcher, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public LibraryStats refresh() throws TransportException {
        Instant fetchedAt = clock.instant();
        JsonNode counts = fetcher.fetch(Endpoint.ITEM_COUNTS);
        JsonNode views = fetcher.fetch(Endpoint.LIBRARY_VIEWS);
        if (!counts.isObject()) {
            throw new TransportException(TransportException.Kind.MALFORMED, "Item counts payload is not an object");
        }

        Map<String, Long> values = new LinkedHashMap<>();
        COUNT_FIELDS.forEach((name, field) -> values.put(name, JsonFields.longValue(counts, field).orElse(0L)));
        LibraryStats stats = new LibraryStats(JsonFields.items(views).size(), values, fetchedAt);
        cached = stats;
        logger.debug("Library stats refreshed: {} libraries, {}", stats.libraryCount(), values);
        return stats;
    }

    public Optional<LibraryStats> current() {
        return Optional.ofNullable(cached);
    }
}

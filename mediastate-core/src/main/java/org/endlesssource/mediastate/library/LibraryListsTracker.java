package org.endlesssource.mediastate.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Feature;
import org.endlesssource.mediastate.api.Fetcher;
import org.endlesssource.mediastate.api.ImageUrls;
import org.endlesssource.mediastate.api.LibraryItem;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.raw.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Latest movies, latest episodes and upcoming episodes.
 * Each list refreshes independently and keeps its previous value on failure.
 */
public final class LibraryListsTracker {
    private static final Logger logger = LoggerFactory.getLogger(LibraryListsTracker.class);

    static final Map<Feature, Endpoint> ENDPOINTS = Map.of(
            Feature.LATEST_MOVIES, Endpoint.LATEST_MOVIES,
            Feature.LATEST_EPISODES, Endpoint.LATEST_EPISODES,
            Feature.UPCOMING_EPISODES, Endpoint.UPCOMING_EPISODES);

    private final Fetcher fetcher;
    private final ImageUrls imageUrls;
    private final Clock clock;
    private final Map<Feature, List<LibraryItem>> lists = Collections.synchronizedMap(new EnumMap<>(Feature.class));

    public LibraryListsTracker(Fetcher fetcher, ImageUrls imageUrls, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.imageUrls = Objects.requireNonNull(imageUrls, "imageUrls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Refresh the enabled lists.
     * @param enabled Features whose list should be refreshed; others are dropped
     * @param limit Maximum entries per list
     * @return The lists that were refreshed or retained
     * @throws TransportException when credentials are rejected, or when every enabled list failed
     */
    public Map<Feature, List<LibraryItem>> refresh(Set<Feature> enabled, int limit) throws TransportException {
        TransportException lastFailure = null;
        int refreshed = 0;
        int requested = 0;
        for (Map.Entry<Feature, Endpoint> entry : ENDPOINTS.entrySet()) {
            Feature feature = entry.getKey();
            if (!enabled.contains(feature)) {
                lists.remove(feature);
                continue;
            }
            requested++;
            try {
                JsonNode payload = fetcher.fetch(entry.getValue(), Map.of(Endpoint.PARAM_LIMIT, Integer.toString(limit)));
                lists.put(feature, toItems(feature, payload, limit));
                refreshed++;
            } catch (TransportException ex) {
                if (ex.isUnauthorized()) {
                    throw ex;
                }
                logger.warn("Failed to refresh {}, keeping previous list: {}", feature, ex.getMessage());
                lastFailure = ex;
            }
        }
        if (requested > 0 && refreshed == 0 && lastFailure != null) {
            throw lastFailure;
        }
        return current();
    }

    public Map<Feature, List<LibraryItem>> current() {
        synchronized (lists) {
            return lists.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(lists));
        }
    }

    List<LibraryItem> toItems(Feature feature, JsonNode payload, int limit) {
        List<LibraryItem> items = new ArrayList<>();
        for (JsonNode node : JsonFields.items(payload)) {
            items.add(toItem(node));
        }
        if (feature == Feature.UPCOMING_EPISODES) {
            Instant now = clock.instant();
            items = items.stream()
                    .filter(item -> item.premiereDate() != null && !item.premiereDate().isBefore(now))
                    .sorted(Comparator.comparing(LibraryItem::premiereDate))
                    .toList();
        }
        return items.size() > limit ? List.copyOf(items.subList(0, limit)) : List.copyOf(items);
    }

    private LibraryItem toItem(JsonNode node) {
        String id = JsonFields.text(node, "Id").orElse(null);
        return new LibraryItem(
                id,
                JsonFields.text(node, "Type").orElse(null),
                JsonFields.text(node, "Name").orElse(null),
                JsonFields.text(node, "SeriesName").orElse(null),
                JsonFields.integer(node, "ParentIndexNumber", "SeasonNumber").orElse(null),
                JsonFields.integer(node, "IndexNumber", "EpisodeNumber").orElse(null),
                JsonFields.instant(node, "PremiereDate")
                        .or(() -> JsonFields.instant(node, "ReleaseDate"))
                        .orElse(null),
                JsonFields.ticks(node, "RunTimeTicks").orElse(null),
                JsonFields.decimal(node, "CommunityRating").orElse(null),
                JsonFields.textList(node, "Genres"),
                id == null ? null : imageUrls.itemImage(id));
    }
}

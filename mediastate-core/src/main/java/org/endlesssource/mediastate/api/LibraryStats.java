package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Library-wide item counts.
 * @param libraryCount Number of libraries visible to the resolved user
 * @param counts Item count per media kind, e.g. {@code movies}
 * @param lastUpdated Time of the fetch that produced these values
 */
public record LibraryStats(int libraryCount, Map<String, Long> counts, Instant lastUpdated) {
    public LibraryStats {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }
}

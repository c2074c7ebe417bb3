package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keyed result of one session poll cycle.
 * @param polledAt When the session list was fetched
 * @param sessions Classified sessions by stable entity key, in observation order
 * @param added Keys first seen in this cycle
 * @param removed Keys seen in the previous cycle but not in this one
 */
public record SessionSnapshot(Instant polledAt,
                              Map<String, ClassifiedSession> sessions,
                              Set<String> added,
                              Set<String> removed) {

    public static final SessionSnapshot EMPTY = new SessionSnapshot(null, Map.of(), Set.of(), Set.of());

    public SessionSnapshot {
        sessions = Collections.unmodifiableMap(new LinkedHashMap<>(sessions));
        added = Collections.unmodifiableSet(new LinkedHashSet<>(added));
        removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
    }
}

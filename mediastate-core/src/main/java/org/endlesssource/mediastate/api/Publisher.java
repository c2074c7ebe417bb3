package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Map;

/**
 * Receives derived state for externally visible entities.
 * Implementations must tolerate repeated calls with unchanged state.
 */
public interface Publisher {

    /**
     * Create or update an entity
     * @param kind The entity kind
     * @param key Stable entity key
     * @param state Primary state value (count, rate, playback state...)
     * @param attributes Additional attributes; absent values are omitted, never null
     */
    void publish(EntityKind kind, String key, Object state, Map<String, Object> attributes);

    /**
     * Mark an entity unavailable after its category kept failing
     * @param kind The entity kind
     * @param key Stable entity key
     * @param lastUpdated Time of the last successful update, null if none
     */
    void markUnavailable(EntityKind kind, String key, Instant lastUpdated);

    /**
     * Tear an entity down
     * @param kind The entity kind
     * @param key Stable entity key
     */
    void remove(EntityKind kind, String key);
}

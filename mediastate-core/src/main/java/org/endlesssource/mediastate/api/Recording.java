package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A recording, a scheduled timer or a series timer.
 * Start and end are set for active and scheduled recordings; the rule only for series.
 */
public record Recording(RecordingKind kind,
                        String id,
                        String name,
                        String channel,
                        Instant start,
                        Instant end,
                        SeriesRule rule) {

    public Recording {
        Objects.requireNonNull(kind, "kind must not be null");
    }
}

package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Current program on a live TV channel. Nullable components are unknown values.
 */
public record Program(String id,
                      String seriesName,
                      String overview,
                      Instant start,
                      Instant end,
                      String imageUrl,
                      String channelName,
                      String channelNumber,
                      String channelId,
                      ProgramSource source) {

    public Program {
        Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Program carrying only what is known about the channel.
     */
    public static Program channelOnly(String channelName, String channelNumber, String channelId) {
        return new Program(null, null, null, null, null, null, channelName, channelNumber, channelId, ProgramSource.NONE);
    }

    public boolean isResolved() {
        return source != ProgramSource.NONE;
    }

    public boolean covers(Instant instant) {
        return start != null && end != null && !instant.isBefore(start) && instant.isBefore(end);
    }
}

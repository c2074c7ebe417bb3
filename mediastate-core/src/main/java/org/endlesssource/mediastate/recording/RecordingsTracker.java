package org.endlesssource.mediastate.recording;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Fetcher;
import org.endlesssource.mediastate.api.Recording;
import org.endlesssource.mediastate.api.RecordingKind;
import org.endlesssource.mediastate.api.RecordingsSnapshot;
import org.endlesssource.mediastate.api.SeriesRule;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.raw.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tracks active recordings, upcoming timers and series timers.
 * Each list is fetched on its own; a failed fetch keeps that list's previous value.
 */
public final class RecordingsTracker {
    private static final Logger logger = LoggerFactory.getLogger(RecordingsTracker.class);

    private final Fetcher fetcher;
    private final Clock clock;
    private volatile RecordingsSnapshot current = RecordingsSnapshot.EMPTY;

    public RecordingsTracker(Fetcher fetcher, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Refresh all three lists.
     * @return The merged snapshot
     * @throws TransportException when credentials are rejected, or when every list failed
     */
    public RecordingsSnapshot refresh() throws TransportException {
        RecordingsSnapshot previous = current;
        Instant now = clock.instant();
        List<TransportException> failures = new ArrayList<>();

        List<Recording> active = fetchList(Endpoint.ACTIVE_RECORDINGS, RecordingKind.ACTIVE, previous.active(), failures);
        List<Recording> scheduled = fetchList(Endpoint.TIMERS, RecordingKind.SCHEDULED, previous.scheduled(), failures);
        if (scheduled != previous.scheduled()) {
            scheduled = scheduled.stream()
                    .filter(recording -> recording.start() != null && recording.start().isAfter(now))
                    .toList();
        }
        List<Recording> series = fetchList(Endpoint.SERIES_TIMERS, RecordingKind.SERIES, previous.series(), failures);

        if (failures.size() == 3) {
            throw failures.get(failures.size() - 1);
        }
        RecordingsSnapshot snapshot = new RecordingsSnapshot(active, scheduled, series);
        current = snapshot;
        logger.debug("Recordings active={} scheduled={} series={}", active.size(), scheduled.size(), series.size());
        return snapshot;
    }

    public RecordingsSnapshot current() {
        return current;
    }

    private List<Recording> fetchList(Endpoint endpoint, RecordingKind kind, List<Recording> previous,
                                      List<TransportException> failures) throws TransportException {
        JsonNode payload;
        try {
            payload = fetcher.fetch(endpoint);
        } catch (TransportException ex) {
            if (ex.isUnauthorized()) {
                throw ex;
            }
            logger.warn("Failed to fetch {} recordings, keeping previous list: {}", kind.id(), ex.getMessage());
            failures.add(ex);
            return previous;
        }
        List<Recording> recordings = new ArrayList<>();
        for (JsonNode item : JsonFields.items(payload)) {
            recordings.add(toRecording(kind, item));
        }
        return List.copyOf(recordings);
    }

    static Recording toRecording(RecordingKind kind, JsonNode item) {
        String id = JsonFields.text(item, "Id").orElse(null);
        if (kind == RecordingKind.SERIES) {
            SeriesRule rule = new SeriesRule(
                    JsonFields.optionalFlag(item, "RecordAnyTime").orElse(true),
                    JsonFields.optionalFlag(item, "RecordAnyChannel").orElse(false),
                    JsonFields.textList(item, "Days"));
            return new Recording(kind, id,
                    JsonFields.text(item, "Name", "SeriesName").orElse(null),
                    JsonFields.text(item, "ChannelName", "ChannelId").orElse(null),
                    null, null, rule);
        }
        // timers describe the airing in their program block when they have one
        JsonNode source = JsonFields.object(item, "ProgramInfo").orElse(item);
        return new Recording(kind, id,
                JsonFields.text(source, "Name", "ProgramName").or(() -> JsonFields.text(item, "Name")).orElse(null),
                JsonFields.text(source, "ChannelName").or(() -> JsonFields.text(item, "ChannelName", "ChannelId"))
                        .orElse(null),
                JsonFields.instant(source, "StartDate").or(() -> JsonFields.instant(item, "StartDate")).orElse(null),
                JsonFields.instant(source, "EndDate").or(() -> JsonFields.instant(item, "EndDate")).orElse(null),
                null);
    }
}

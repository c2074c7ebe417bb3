package org.endlesssource.mediastate.recording;

import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Recording;
import org.endlesssource.mediastate.api.RecordingsSnapshot;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.test.FakeServerClient;
import org.endlesssource.mediastate.test.Payloads;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordingsTrackerTest {
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private final FakeServerClient client = new FakeServerClient();
    private final RecordingsTracker tracker = new RecordingsTracker(client, Clock.fixed(NOW, ZoneOffset.UTC));

    private void respondAll() {
        client.respond(Endpoint.ACTIVE_RECORDINGS, Payloads.load("active_recordings.json"))
                .respond(Endpoint.TIMERS, Payloads.load("timers.json"))
                .respond(Endpoint.SERIES_TIMERS, Payloads.load("series_timers.json"));
    }

    @Test
    void refresh_keepsOnlyFutureTimers() throws Exception {
        respondAll();

        RecordingsSnapshot snapshot = tracker.refresh();

        assertEquals(1, snapshot.active().size());
        assertEquals(List.of("t-1", "t-3"), snapshot.scheduled().stream().map(Recording::id).toList());
        assertEquals(2, snapshot.series().size());
        assertEquals(5, snapshot.total());
        assertSame(snapshot, tracker.current());
    }

    @Test
    void timer_prefersProgramInfo() throws Exception {
        respondAll();

        Recording timer = tracker.refresh().scheduled().get(0);

        assertEquals("Gardeners' World", timer.name());
        assertEquals("BBC Two", timer.channel());
        assertEquals(Instant.parse("2026-10-20T20:00:00Z"), timer.start());
        assertEquals(Instant.parse("2026-10-20T21:00:00Z"), timer.end());
        assertNull(timer.rule());
    }

    @Test
    void seriesTimers_carryRuleWithDefaults() throws Exception {
        respondAll();

        List<Recording> series = tracker.refresh().series();

        Recording doctorWho = series.get(0);
        assertTrue(doctorWho.rule().recordAnyTime());
        assertFalse(doctorWho.rule().recordAnyChannel());
        assertEquals(List.of("Saturday"), doctorWho.rule().days());

        Recording taskmaster = series.get(1);
        assertEquals("ch-4", taskmaster.channel());
        assertTrue(taskmaster.rule().recordAnyTime());
        assertFalse(taskmaster.rule().recordAnyChannel());
        assertTrue(taskmaster.rule().days().isEmpty());
    }

    @Test
    void failedList_keepsPreviousValue() throws Exception {
        respondAll();
        RecordingsSnapshot first = tracker.refresh();

        client.fail(Endpoint.TIMERS, TransportException.Kind.TIMEOUT);
        RecordingsSnapshot second = tracker.refresh();

        assertEquals(first.scheduled(), second.scheduled());
        assertEquals(first.active(), second.active());
        assertEquals(2L, client.callCount(Endpoint.TIMERS));
    }

    @Test
    void everyListFailing_throws() {
        client.fail(Endpoint.ACTIVE_RECORDINGS, TransportException.Kind.UNREACHABLE)
                .fail(Endpoint.TIMERS, TransportException.Kind.UNREACHABLE)
                .fail(Endpoint.SERIES_TIMERS, TransportException.Kind.UNREACHABLE);

        TransportException ex = assertThrows(TransportException.class, tracker::refresh);
        assertEquals(TransportException.Kind.UNREACHABLE, ex.getKind());
        assertSame(RecordingsSnapshot.EMPTY, tracker.current());
    }

    @Test
    void unauthorized_isRethrownImmediately() {
        respondAll();
        client.fail(Endpoint.ACTIVE_RECORDINGS, TransportException.Kind.UNAUTHORIZED);

        TransportException ex = assertThrows(TransportException.class, tracker::refresh);
        assertTrue(ex.isUnauthorized());
        assertEquals(0L, client.callCount(Endpoint.TIMERS));
    }
}

package org.endlesssource.mediastate.publish;

import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.Program;
import org.endlesssource.mediastate.api.ProgramSource;
import org.endlesssource.mediastate.raw.RawSession;
import org.endlesssource.mediastate.session.MediaClassifier;
import org.endlesssource.mediastate.session.TranscodeAnalyzer;
import org.endlesssource.mediastate.test.FakeServerClient;
import org.endlesssource.mediastate.test.Payloads;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionAttributesTest {
    private static final Instant NOW = Instant.parse("2026-10-19T22:10:00Z");

    private final List<ClassifiedSession> sessions = RawSession.listOf(Payloads.load("sessions_mixed.json")).stream()
            .map(new MediaClassifier(new FakeServerClient(), new TranscodeAnalyzer(), Clock.fixed(NOW, ZoneOffset.UTC))::classify)
            .toList();

    @Test
    void movie_carriesMovieFieldsOnly() {
        Map<String, Object> attributes = SessionAttributes.of(sessions.get(0));

        assertEquals("Inception", attributes.get("media_title"));
        assertEquals("m-100", attributes.get("media_content_id"));
        assertEquals(50.0d, attributes.get("playback_percent"));
        assertEquals(7200L, attributes.get("media_duration"));
        assertEquals(3600L, attributes.get("media_position"));
        assertEquals("direct", attributes.get("playback_method"));
        assertEquals("Living Room TV (john)", attributes.get("friendly_name"));
        assertEquals("john on Living Room TV", attributes.get("custom_name"));
        assertFalse(attributes.containsKey("media_series_title"));
        assertFalse(attributes.containsKey("media_channel"));
        assertFalse(attributes.containsKey("transcode_video_codec"));
    }

    @Test
    void episode_carriesSeriesFieldsAndTranscodeTargets() {
        Map<String, Object> attributes = SessionAttributes.of(sessions.get(1));

        assertEquals("Lost", attributes.get("media_series_title"));
        assertEquals(1, attributes.get("media_season"));
        assertEquals(1, attributes.get("media_episode"));
        assertEquals("transcoding", attributes.get("playback_method"));
        assertEquals("4000kbps", attributes.get("transcode_bitrate"));
        assertEquals(List.of("ContainerNotSupported", "AudioCodecNotSupported"), attributes.get("transcode_reasons"));
        assertFalse(attributes.containsKey("video_codec"));
    }

    @Test
    void liveTv_carriesChannelAndProgramFields() {
        ClassifiedSession session = sessions.get(2);
        LiveTv live = (LiveTv) session.media();
        Program program = new Program("p-900", "News at Ten", "Headlines", Instant.parse("2026-10-19T22:00:00Z"),
                Instant.parse("2026-10-19T22:30:00Z"), "http://emby.test/Items/p-900/Images/Primary",
                "BBC One", "101", "ch-1", ProgramSource.CHANNEL_SEARCH);
        ClassifiedSession resolved = session.withMedia(live.withProgram(program, NOW), 33.3d);

        Map<String, Object> attributes = SessionAttributes.of(resolved);

        assertEquals("BBC One", attributes.get("media_channel"));
        assertEquals("101", attributes.get("channel_number"));
        assertEquals("channel_search", attributes.get("program_source"));
        assertEquals("News at Ten", attributes.get("program_series"));
        assertEquals(1800L, attributes.get("media_duration"));
        assertEquals(600L, attributes.get("media_position"));
        assertFalse(attributes.containsKey("media_title"));
        assertFalse(attributes.containsKey("media_season"));
    }

    @Test
    void idleSession_omitsAbsentValues() {
        Map<String, Object> attributes = SessionAttributes.of(sessions.get(3));

        assertEquals("none", attributes.get("media_kind"));
        assertEquals("Pixel 7", attributes.get("device_name"));
        assertFalse(attributes.containsKey("playback_percent"));
        assertFalse(attributes.containsKey("media_position"));
        assertFalse(attributes.containsKey("content_type"));
        assertTrue(attributes.values().stream().noneMatch(value -> value == null));
    }
}

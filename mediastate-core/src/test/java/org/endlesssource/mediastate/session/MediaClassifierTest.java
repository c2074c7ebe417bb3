package org.endlesssource.mediastate.session;

import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.Episode;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.MediaKind;
import org.endlesssource.mediastate.api.Movie;
import org.endlesssource.mediastate.api.NoMedia;
import org.endlesssource.mediastate.api.PlaybackMethod;
import org.endlesssource.mediastate.api.PlaybackState;
import org.endlesssource.mediastate.raw.RawSession;
import org.endlesssource.mediastate.test.FakeServerClient;
import org.endlesssource.mediastate.test.Payloads;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MediaClassifierTest {
    private static final Instant NOW = Instant.parse("2026-10-19T22:10:00Z");

    private final MediaClassifier classifier = new MediaClassifier(new FakeServerClient(), new TranscodeAnalyzer(),
            Clock.fixed(NOW, ZoneOffset.UTC));

    private ClassifiedSession classify(String json) {
        return classifier.classify(new RawSession(Payloads.json(json)));
    }

    @Test
    void movieAtHalfway_hasFiftyPercent() {
        ClassifiedSession session = classify("{'Id':'s1','DeviceName':'TV','UserName':'john',"
                + "'NowPlayingItem':{'Id':'m1','Name':'Heat','Type':'Movie','RunTimeTicks':72000000000},"
                + "'PlayState':{'PositionTicks':36000000000}}");

        Movie movie = assertInstanceOf(Movie.class, session.media());
        assertEquals("Heat", movie.title());
        assertEquals(Duration.ofSeconds(7200), movie.duration());
        assertEquals(Duration.ofSeconds(3600), movie.position());
        assertEquals(FakeServerClient.IMAGE_BASE + "/Items/m1/Images/Primary", movie.posterUrl());
        assertEquals(50.0d, session.playbackPercent());
        assertEquals(PlaybackState.PLAYING, session.state());
        assertEquals("movie", session.contentType());
        assertEquals(NOW, session.positionUpdatedAt());
    }

    @Test
    void noNowPlayingItem_isNoneAndIdle() {
        ClassifiedSession session = classify("{'Id':'s1','DeviceName':'Phone','UserName':'mary'}");

        assertSame(NoMedia.INSTANCE, session.media());
        assertEquals(MediaKind.NONE, session.media().kind());
        assertEquals(PlaybackState.IDLE, session.state());
        assertNull(session.playbackPercent());
        assertFalse(session.isActiveStream());
    }

    @Test
    void episode_carriesSeriesSeasonAndNumber() {
        ClassifiedSession session = classify("{'DeviceName':'Chrome',"
                + "'NowPlayingItem':{'Id':'e1','Name':'Pilot','Type':'Episode','SeriesName':'Lost',"
                + "'ParentIndexNumber':1,'IndexNumber':2,'RunTimeTicks':26000000000},"
                + "'PlayState':{'PositionTicks':13000000000,'IsPaused':true}}");

        Episode episode = assertInstanceOf(Episode.class, session.media());
        assertEquals("Lost", episode.seriesTitle());
        assertEquals(1, episode.season());
        assertEquals(2, episode.episode());
        assertEquals(50.0d, session.playbackPercent());
        assertEquals(PlaybackState.PAUSED, session.state());
        assertEquals("tvshow", session.contentType());
    }

    @Test
    void tvChannel_isUnresolvedLiveTv() {
        ClassifiedSession session = classify("{'DeviceName':'Roku',"
                + "'NowPlayingItem':{'Id':'ch-1','Name':'BBC One','Type':'TvChannel','ChannelNumber':'101'},"
                + "'PlayState':{'PositionTicks':0}}");

        LiveTv live = assertInstanceOf(LiveTv.class, session.media());
        assertEquals("BBC One", live.channelName());
        assertEquals("101", live.channelNumber());
        assertEquals("ch-1", live.channelId());
        assertNull(live.program());
        assertNull(live.duration());
        assertNull(session.playbackPercent());
        assertEquals("tvchannel", session.contentType());
    }

    @Test
    void liveProgram_takesChannelIdAndProgramHint() {
        ClassifiedSession session = classify("{'DeviceName':'Roku',"
                + "'NowPlayingItem':{'Id':'p-77','Name':'News','Type':'Program','ChannelId':'ch-9'},"
                + "'PlayState':{}}");

        LiveTv live = assertInstanceOf(LiveTv.class, session.media());
        assertEquals("ch-9", live.channelId());
        assertNull(live.programIdHint());

        ClassifiedSession hinted = classify("{'DeviceName':'Roku',"
                + "'NowPlayingItem':{'Id':'ch-9','Name':'BBC','Type':'TvChannel','CurrentProgram':{'Id':'p-1'}}}");
        assertEquals("p-1", ((LiveTv) hinted.media()).programIdHint());
    }

    @Test
    void unknownPlayableType_fallsBackToMovieShape() {
        ClassifiedSession session = classify("{'DeviceName':'Speaker',"
                + "'NowPlayingItem':{'Id':'a1','Name':'Song 2','Type':'Audio','RunTimeTicks':1210000000},"
                + "'PlayState':{'PositionTicks':605000000}}");

        Movie movie = assertInstanceOf(Movie.class, session.media());
        assertEquals("Song 2", movie.title());
        assertEquals("Audio", session.itemType());
        assertEquals("music", session.contentType());
        assertEquals(50.0d, session.playbackPercent());
    }

    @Test
    void playbackPercent_isClampedAndOmittedWithoutDuration() {
        assertEquals(100.0d, MediaClassifier.playbackPercent(Duration.ofSeconds(130), Duration.ofSeconds(100)));
        assertEquals(0.0d, MediaClassifier.playbackPercent(Duration.ofSeconds(-5), Duration.ofSeconds(100)));
        assertEquals(33.3d, MediaClassifier.playbackPercent(Duration.ofSeconds(1), Duration.ofSeconds(3)));
        assertNull(MediaClassifier.playbackPercent(Duration.ofSeconds(10), Duration.ZERO));
        assertNull(MediaClassifier.playbackPercent(Duration.ofSeconds(10), Duration.ofSeconds(-1)));
        assertNull(MediaClassifier.playbackPercent(Duration.ofSeconds(10), null));
        assertNull(MediaClassifier.playbackPercent(null, Duration.ofSeconds(10)));
    }

    @Test
    void zeroRuntime_omitsPercent() {
        ClassifiedSession session = classify("{'DeviceName':'TV',"
                + "'NowPlayingItem':{'Id':'m1','Name':'Clip','Type':'Movie','RunTimeTicks':0},"
                + "'PlayState':{'PositionTicks':50000000}}");
        assertNull(session.playbackPercent());
    }

    @Test
    void fixtureSessions_classifyWithStreamsAndImages() {
        List<ClassifiedSession> sessions = RawSession.listOf(Payloads.load("sessions_mixed.json")).stream()
                .map(classifier::classify)
                .toList();

        assertEquals(4, sessions.size());
        ClassifiedSession movie = sessions.get(0);
        assertEquals("Emby Theater", movie.appName());
        assertEquals("h264", movie.video().codec());
        assertEquals("1920x1080", movie.video().resolution());
        assertEquals(6, movie.audio().channels());
        assertEquals("eng", movie.audio().language());
        assertEquals(FakeServerClient.IMAGE_BASE + "/Users/u-john/Images/Primary", movie.userImageUrl());
        assertEquals(PlaybackMethod.DIRECT, movie.transcode().method());
        assertTrue(movie.isActiveStream());

        ClassifiedSession episode = sessions.get(1);
        assertEquals(PlaybackMethod.TRANSCODING, episode.transcode().method());
        assertEquals(3_800_000L, episode.bandwidth().videoBps());
        assertEquals(192_000L, episode.bandwidth().audioBps());

        assertFalse(sessions.get(3).isActiveStream());
        assertFalse(sessions.get(3).playbackReported());
    }

    @Test
    void contentType_mapsKnownTypesAndKeepsOthersLowerCased() {
        assertEquals("tvshow", MediaClassifier.contentType("Episode"));
        assertEquals("music", MediaClassifier.contentType("MusicVideo"));
        assertEquals("tvchannel", MediaClassifier.contentType("LiveTvChannel"));
        assertEquals("photo", MediaClassifier.contentType("Photo"));
        assertNull(MediaClassifier.contentType(null));
    }
}

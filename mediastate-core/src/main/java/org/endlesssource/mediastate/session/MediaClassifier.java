package org.endlesssource.mediastate.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.AudioStream;
import org.endlesssource.mediastate.api.BandwidthSample;
import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.Episode;
import org.endlesssource.mediastate.api.ImageUrls;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.MediaVariant;
import org.endlesssource.mediastate.api.Movie;
import org.endlesssource.mediastate.api.NoMedia;
import org.endlesssource.mediastate.api.PlaybackState;
import org.endlesssource.mediastate.api.TranscodeInfo;
import org.endlesssource.mediastate.api.VideoStream;
import org.endlesssource.mediastate.raw.JsonFields;
import org.endlesssource.mediastate.raw.RawSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a raw session onto the closed set of media variants plus the attributes
 * common to all sessions. Pure apart from reading the clock.
 */
public final class MediaClassifier {
    private static final Logger logger = LoggerFactory.getLogger(MediaClassifier.class);
    private static final Set<String> LIVE_TV_TYPES = Set.of("tvchannel", "livetvchannel", "program");

    private final ImageUrls imageUrls;
    private final TranscodeAnalyzer transcodeAnalyzer;
    private final Clock clock;

    public MediaClassifier(ImageUrls imageUrls, TranscodeAnalyzer transcodeAnalyzer, Clock clock) {
        this.imageUrls = Objects.requireNonNull(imageUrls, "imageUrls must not be null");
        this.transcodeAnalyzer = Objects.requireNonNull(transcodeAnalyzer, "transcodeAnalyzer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ClassifiedSession classify(RawSession session) {
        Optional<JsonNode> item = session.nowPlaying();
        JsonNode playState = session.playState();
        MediaVariant media = classifyMedia(session);

        Duration duration = item.flatMap(np -> JsonFields.ticks(np, "RunTimeTicks")).orElse(null);
        Duration position = JsonFields.ticks(playState, "PositionTicks").orElse(null);
        Double percent = media instanceof LiveTv ? null : playbackPercent(position, duration);

        String userId = session.userId().orElse(null);
        String itemType = item.flatMap(np -> JsonFields.text(np, "Type")).orElse(null);
        TranscodeInfo transcode = transcodeAnalyzer.analyze(session);

        return new ClassifiedSession(
                session.id().orElse(null),
                session.deviceId().orElse(null),
                session.deviceName().orElse(null),
                userId,
                session.userName().orElse(null),
                userId == null ? null : imageUrls.userImage(userId),
                session.appName().orElse(null),
                playbackState(item.isPresent(), playState),
                itemType,
                contentType(itemType),
                item.flatMap(np -> JsonFields.text(np, "Name")).orElse(null),
                media,
                item.flatMap(MediaClassifier::videoStream).orElse(null),
                item.flatMap(MediaClassifier::audioStream).orElse(null),
                transcode,
                bandwidth(session),
                session.hasPlayState(),
                percent,
                position == null ? null : Instant.now(clock));
    }

    /**
     * Variant for the session's now-playing item. Unknown playable types fall back to the movie shape.
     */
    public MediaVariant classifyMedia(RawSession session) {
        Optional<JsonNode> nowPlaying = session.nowPlaying();
        if (nowPlaying.isEmpty()) {
            return NoMedia.INSTANCE;
        }
        JsonNode item = nowPlaying.get();
        String type = JsonFields.text(item, "Type").orElse("").toLowerCase(Locale.ROOT);
        String contentId = JsonFields.text(item, "Id").orElse(null);
        Duration duration = JsonFields.ticks(item, "RunTimeTicks").orElse(null);
        Duration position = JsonFields.ticks(session.playState(), "PositionTicks").orElse(null);
        String poster = contentId == null ? null : imageUrls.itemImage(contentId);

        if ("episode".equals(type)) {
            return new Episode(
                    JsonFields.text(item, "Name").orElse(null),
                    JsonFields.text(item, "SeriesName").orElse(null),
                    JsonFields.integer(item, "ParentIndexNumber", "SeasonNumber").orElse(null),
                    JsonFields.integer(item, "IndexNumber", "EpisodeNumber").orElse(null),
                    contentId, duration, position, poster);
        }
        if (LIVE_TV_TYPES.contains(type)) {
            return LiveTv.unresolved(
                    JsonFields.text(item, "Name", "ChannelName").orElse(null),
                    JsonFields.text(item, "ChannelNumber", "Number").orElse(null),
                    JsonFields.text(item, "ChannelId").orElse(contentId),
                    programIdHint(session, item).orElse(null));
        }
        if (!"movie".equals(type)) {
            logger.debug("Classifying item type '{}' of session {} as movie-shaped", type, session.id().orElse("?"));
        }
        return new Movie(JsonFields.text(item, "Name").orElse(null), contentId, duration, position, poster);
    }

    /**
     * Position over duration in percent, rounded to one decimal and clamped to [0, 100].
     * @return null when either value is unknown or the duration is not positive
     */
    public static Double playbackPercent(Duration position, Duration duration) {
        if (position == null || duration == null || duration.isZero() || duration.isNegative()) {
            return null;
        }
        double percent = (double) position.toMillis() / (double) duration.toMillis() * 100.0d;
        percent = Math.max(0.0d, Math.min(100.0d, percent));
        return Math.round(percent * 10.0d) / 10.0d;
    }

    static String contentType(String itemType) {
        if (itemType == null || itemType.isBlank()) {
            return null;
        }
        String type = itemType.toLowerCase(Locale.ROOT);
        return switch (type) {
            case "episode" -> "tvshow";
            case "movie" -> "movie";
            case "audio", "audiofile", "music", "musicvideo" -> "music";
            case "livetvchannel", "tvchannel", "program" -> "tvchannel";
            default -> type;
        };
    }

    static PlaybackState playbackState(boolean hasItem, JsonNode playState) {
        if (!hasItem) {
            return PlaybackState.IDLE;
        }
        return JsonFields.flag(playState, "IsPaused") ? PlaybackState.PAUSED : PlaybackState.PLAYING;
    }

    static BandwidthSample bandwidth(RawSession session) {
        JsonNode root = session.node();
        JsonNode playState = session.playState();
        JsonNode info = session.transcodingInfo().orElse(null);
        long video = firstPositive(playState, info, root, "VideoBitrate");
        long audio = firstPositive(playState, info, root, "AudioBitrate");
        long overall = firstPositive(info, root, null, "Bitrate");
        return new BandwidthSample(video, audio, overall);
    }

    private static long firstPositive(JsonNode first, JsonNode second, JsonNode third, String field) {
        for (JsonNode node : new JsonNode[]{first, second, third}) {
            if (node == null) {
                continue;
            }
            long value = JsonFields.bitrate(node, field).orElse(0L);
            if (value > 0) {
                return value;
            }
        }
        return 0L;
    }

    private static Optional<String> programIdHint(RawSession session, JsonNode item) {
        return JsonFields.text(item, "ProgramId")
                .or(() -> session.nowPlayingProgram().flatMap(program -> JsonFields.text(program, "Id")))
                .or(() -> JsonFields.object(item, "CurrentProgram").flatMap(program -> JsonFields.text(program, "Id")))
                .or(session::nowPlayingProgramId);
    }

    private static Optional<VideoStream> videoStream(JsonNode item) {
        return firstStream(item, "Video").map(stream -> new VideoStream(
                JsonFields.text(stream, "Codec").orElse(null),
                JsonFields.integer(stream, "Width").orElse(null),
                JsonFields.integer(stream, "Height").orElse(null),
                JsonFields.decimal(stream, "RealFrameRate")
                        .or(() -> JsonFields.decimal(stream, "AverageFrameRate"))
                        .orElse(null),
                JsonFields.longValue(stream, "BitRate").orElse(null)));
    }

    private static Optional<AudioStream> audioStream(JsonNode item) {
        return firstStream(item, "Audio").map(stream -> new AudioStream(
                JsonFields.text(stream, "Codec").orElse(null),
                JsonFields.integer(stream, "Channels").orElse(null),
                JsonFields.longValue(stream, "BitRate").orElse(null),
                JsonFields.integer(stream, "SampleRate").orElse(null),
                JsonFields.text(stream, "Language").orElse(null)));
    }

    private static Optional<JsonNode> firstStream(JsonNode item, String type) {
        JsonNode streams = item.get("MediaStreams");
        if (streams == null || !streams.isArray()) {
            return Optional.empty();
        }
        for (JsonNode stream : streams) {
            if (type.equalsIgnoreCase(JsonFields.text(stream, "Type").orElse(""))) {
                return Optional.of(stream);
            }
        }
        return Optional.empty();
    }
}

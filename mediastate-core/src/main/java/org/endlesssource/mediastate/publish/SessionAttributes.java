package org.endlesssource.mediastate.publish;

import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.Episode;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.Movie;
import org.endlesssource.mediastate.api.Program;
import org.endlesssource.mediastate.api.TranscodeInfo;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a classified session into published attributes.
 * Only the fields of the session's own media variant appear.
 */
public final class SessionAttributes {

    private SessionAttributes() {}

    public static Map<String, Object> of(ClassifiedSession session) {
        Attributes attributes = new Attributes()
                .put("app_name", session.appName())
                .put("user_name", session.userName())
                .put("user_id", session.userId())
                .put("user_image", session.userImageUrl())
                .put("device_name", session.deviceName())
                .put("device_id", session.deviceId())
                .put("friendly_name", friendlyName(session))
                .put("custom_name", customName(session))
                .put("media_kind", session.media().kind().name().toLowerCase(Locale.ROOT))
                .put("content_type", session.contentType())
                .put("item_type", session.itemType());

        if (session.video() != null) {
            attributes.put("video_codec", session.video().codec())
                    .put("video_resolution", session.video().resolution())
                    .put("video_framerate", session.video().framerate())
                    .put("video_bitrate", session.video().bitrate());
        }
        if (session.audio() != null) {
            attributes.put("audio_codec", session.audio().codec())
                    .put("audio_channels", session.audio().channels())
                    .put("audio_bitrate", session.audio().bitrate())
                    .put("audio_sample_rate", session.audio().sampleRate())
                    .put("audio_language", session.audio().language());
        }

        TranscodeInfo transcode = session.transcode();
        attributes.put("playback_method", transcode.method().id())
                .put("play_method", transcode.playMethod());
        if (transcode.isTranscoding()) {
            attributes.put("transcode_video_codec", transcode.videoCodec())
                    .put("transcode_audio_codec", transcode.audioCodec())
                    .put("transcode_bitrate", transcode.bitrate())
                    .put("transcode_container", transcode.container())
                    .put("transcode_reasons", transcode.reasons());
        }

        attributes.put("playback_percent", session.playbackPercent())
                .put("media_duration", seconds(session.mediaDuration()))
                .put("media_position", seconds(session.mediaPosition()))
                .put("media_position_updated_at", session.positionUpdatedAt());

        if (session.media() instanceof Movie movie) {
            attributes.put("media_title", movie.title())
                    .put("media_content_id", movie.contentId())
                    .put("entity_picture", movie.posterUrl());
        } else if (session.media() instanceof Episode episode) {
            attributes.put("media_title", episode.title())
                    .put("media_series_title", episode.seriesTitle())
                    .put("media_season", episode.season())
                    .put("media_episode", episode.episode())
                    .put("media_content_id", episode.contentId())
                    .put("entity_picture", episode.posterUrl());
        } else if (session.media() instanceof LiveTv live) {
            attributes.put("media_channel", live.channelName())
                    .put("channel_number", live.channelNumber())
                    .put("channel_id", live.channelId());
            Program program = live.program();
            if (program != null) {
                attributes.put("program_source", program.source().id())
                        .put("program_id", program.id())
                        .put("program_series", program.seriesName())
                        .put("program_overview", program.overview())
                        .put("program_start", program.start())
                        .put("program_end", program.end())
                        .put("entity_picture", program.imageUrl());
            }
        }
        return attributes.build();
    }

    static String friendlyName(ClassifiedSession session) {
        if (session.deviceName() == null) {
            return session.userName();
        }
        return session.userName() == null
                ? session.deviceName()
                : session.deviceName() + " (" + session.userName() + ")";
    }

    static String customName(ClassifiedSession session) {
        if (session.userName() == null || session.deviceName() == null) {
            return null;
        }
        return session.userName() + " on " + session.deviceName();
    }

    private static Long seconds(Duration duration) {
        return duration == null ? null : duration.toSeconds();
    }
}

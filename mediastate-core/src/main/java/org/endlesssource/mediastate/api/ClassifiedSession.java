package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One server session after classification. Nullable components are unknown values.
 *
 * @param serverSessionId Server-assigned id; may change while the logical session persists
 * @param deviceName Device name, falling back to the client name
 * @param itemType Raw type of the now-playing item, null when idle
 * @param contentType Normalized content type (movie, tvshow, music, tvchannel or the lower-cased raw type)
 * @param mediaName Raw name of the now-playing item
 * @param playbackReported Whether the server reported a play state for this session
 * @param playbackPercent Position over duration in percent, clamped to [0, 100]
 */
public record ClassifiedSession(String serverSessionId,
                                String deviceId,
                                String deviceName,
                                String userId,
                                String userName,
                                String userImageUrl,
                                String appName,
                                PlaybackState state,
                                String itemType,
                                String contentType,
                                String mediaName,
                                MediaVariant media,
                                VideoStream video,
                                AudioStream audio,
                                TranscodeInfo transcode,
                                BandwidthSample bandwidth,
                                boolean playbackReported,
                                Double playbackPercent,
                                Instant positionUpdatedAt) {

    public ClassifiedSession {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(media, "media must not be null");
        transcode = transcode == null ? TranscodeInfo.DIRECT : transcode;
        bandwidth = bandwidth == null ? BandwidthSample.EMPTY : bandwidth;
    }

    /**
     * A session counts as an active stream when it has media and reports playback progress.
     */
    public boolean isActiveStream() {
        return media.kind() != MediaKind.NONE && playbackReported;
    }

    public Duration mediaDuration() {
        if (media instanceof Movie movie) {
            return movie.duration();
        }
        if (media instanceof Episode episode) {
            return episode.duration();
        }
        if (media instanceof LiveTv liveTv) {
            return liveTv.duration();
        }
        return null;
    }

    public Duration mediaPosition() {
        if (media instanceof Movie movie) {
            return movie.position();
        }
        if (media instanceof Episode episode) {
            return episode.position();
        }
        if (media instanceof LiveTv liveTv) {
            return liveTv.position();
        }
        return null;
    }

    /**
     * Copy with a replaced media variant and playback percent.
     */
    public ClassifiedSession withMedia(MediaVariant newMedia, Double newPlaybackPercent) {
        return new ClassifiedSession(serverSessionId, deviceId, deviceName, userId, userName, userImageUrl, appName,
                state, itemType, contentType, mediaName, newMedia, video, audio, transcode, bandwidth,
                playbackReported, newPlaybackPercent, positionUpdatedAt);
    }
}

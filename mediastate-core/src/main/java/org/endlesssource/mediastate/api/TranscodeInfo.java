package org.endlesssource.mediastate.api;

import java.util.List;
import java.util.Objects;

/**
 * Playback method of a session and, when transcoding, the transcode targets.
 * Target fields are null when the server did not report them.
 */
public record TranscodeInfo(PlaybackMethod method,
                            String playMethod,
                            String videoCodec,
                            String audioCodec,
                            String bitrate,
                            String container,
                            List<String> reasons) {

    public static final TranscodeInfo DIRECT = new TranscodeInfo(PlaybackMethod.DIRECT, null, null, null, null, null, List.of());

    public TranscodeInfo {
        Objects.requireNonNull(method, "method must not be null");
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public boolean isTranscoding() {
        return method == PlaybackMethod.TRANSCODING;
    }
}

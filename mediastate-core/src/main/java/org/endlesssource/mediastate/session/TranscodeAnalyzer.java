package org.endlesssource.mediastate.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.PlaybackMethod;
import org.endlesssource.mediastate.api.TranscodeInfo;
import org.endlesssource.mediastate.raw.JsonFields;
import org.endlesssource.mediastate.raw.RawSession;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the playback method of a session and its transcode targets.
 * A session is transcoding exactly when it carries a non-empty transcoding block.
 */
public final class TranscodeAnalyzer {

    public TranscodeInfo analyze(RawSession session) {
        JsonNode playState = session.playState();
        String playMethod = JsonFields.text(playState, "PlayMethod")
                .or(() -> JsonFields.text(session.node(), "PlayMethod"))
                .orElse(null);

        Optional<JsonNode> block = session.transcodingInfo();
        if (block.isEmpty()) {
            return new TranscodeInfo(PlaybackMethod.DIRECT, playMethod, null, null, null, null, List.of());
        }

        JsonNode info = block.get();
        String videoCodec = JsonFields.text(info, "VideoCodec")
                .or(() -> JsonFields.text(playState, "TranscodingVideoCodec"))
                .orElse(null);
        String audioCodec = JsonFields.text(info, "AudioCodec")
                .or(() -> JsonFields.text(playState, "TranscodingAudioCodec"))
                .orElse(null);
        String bitrate = formatBitrate(info, "Bitrate")
                .or(() -> formatBitrate(playState, "Bitrate"))
                .orElse(null);
        String container = JsonFields.text(info, "Container").orElse(null);

        // reasons are reported verbatim, never inferred
        Set<String> reasons = new LinkedHashSet<>();
        reasons.addAll(JsonFields.textList(info, "TranscodeReasons"));
        reasons.addAll(JsonFields.textList(info, "TranscodingReason"));
        reasons.addAll(JsonFields.textList(playState, "TranscodingReason"));

        return new TranscodeInfo(PlaybackMethod.TRANSCODING, playMethod, videoCodec, audioCodec, bitrate,
                container, List.copyOf(reasons));
    }

    /**
     * Numeric bitrates (bits per second) render as whole kbps; any other text is kept as reported.
     */
    static Optional<String> formatBitrate(JsonNode node, String field) {
        Optional<String> text = JsonFields.text(node, field);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Optional<Long> numeric = JsonFields.longValue(node, field);
        if (numeric.isPresent()) {
            long bps = numeric.get();
            return bps > 0 ? Optional.of(bps / 1000 + "kbps") : Optional.empty();
        }
        return text;
    }
}

package org.endlesssource.mediastate.aggregate;

import java.util.List;

/**
 * Share of active streams that are transcoding.
 * @param percent 0 to 100, one decimal; 0 without active streams
 */
public record TranscodingLoad(double percent, int transcodingCount, int activeCount, List<TranscodeDetail> details) {
    public TranscodingLoad {
        details = List.copyOf(details);
    }
}

package org.endlesssource.mediastate.aggregate;

import java.util.List;

public record TranscodeDetail(String sessionKey,
                              String user,
                              String device,
                              String media,
                              String videoCodec,
                              String audioCodec,
                              String bitrate,
                              List<String> reasons) {
    public TranscodeDetail {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}

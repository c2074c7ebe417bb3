package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.time.Instant;

/**
 * Live TV channel playback. Carries no title; the channel name stands in for it.
 * Duration and position are derived from the resolved program window.
 */
public record LiveTv(String channelName,
                     String channelNumber,
                     String channelId,
                     String programIdHint,
                     Program program,
                     Duration duration,
                     Duration position) implements MediaVariant {

    /**
     * Channel-only variant, before the current program is resolved.
     */
    public static LiveTv unresolved(String channelName, String channelNumber, String channelId, String programIdHint) {
        return new LiveTv(channelName, channelNumber, channelId, programIdHint, null, null, null);
    }

    @Override
    public MediaKind kind() {
        return MediaKind.LIVE_TV;
    }

    /**
     * Attach a program and derive duration/position from its window.
     * @param resolved The program, possibly channel-only
     * @param now Current time
     * @return A new variant with channel number adopted from the program when missing
     */
    public LiveTv withProgram(Program resolved, Instant now) {
        String number = channelNumber != null ? channelNumber : resolved.channelNumber();
        String id = channelId != null ? channelId : resolved.channelId();
        Duration programDuration = null;
        Duration programPosition = null;
        if (resolved.isResolved() && resolved.start() != null && resolved.end() != null) {
            programDuration = Duration.between(resolved.start(), resolved.end());
            if (programDuration.isNegative()) {
                programDuration = Duration.ZERO;
            }
            programPosition = Duration.between(resolved.start(), now);
            if (programPosition.isNegative()) {
                programPosition = Duration.ZERO;
            } else if (programPosition.compareTo(programDuration) > 0) {
                programPosition = programDuration;
            }
        }
        return new LiveTv(channelName, number, id, programIdHint, resolved, programDuration, programPosition);
    }
}

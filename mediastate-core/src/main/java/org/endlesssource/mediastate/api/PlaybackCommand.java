package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One of the four pass-through transport commands.
 */
public record PlaybackCommand(Type type, Duration position) {

    public enum Type {
        PLAY,
        PAUSE,
        STOP,
        SEEK
    }

    public PlaybackCommand {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.SEEK) {
            Objects.requireNonNull(position, "seek position must not be null");
            if (position.isNegative()) {
                throw new IllegalArgumentException("seek position must not be negative");
            }
        } else {
            position = null;
        }
    }

    public static PlaybackCommand play() {
        return new PlaybackCommand(Type.PLAY, null);
    }

    public static PlaybackCommand pause() {
        return new PlaybackCommand(Type.PAUSE, null);
    }

    public static PlaybackCommand stop() {
        return new PlaybackCommand(Type.STOP, null);
    }

    public static PlaybackCommand seek(Duration position) {
        return new PlaybackCommand(Type.SEEK, position);
    }

    public Optional<Duration> seekPosition() {
        return Optional.ofNullable(position);
    }
}

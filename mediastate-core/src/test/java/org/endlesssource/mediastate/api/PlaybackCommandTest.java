package org.endlesssource.mediastate.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlaybackCommandTest {

    @Test
    void seek_requiresNonNegativePosition() {
        assertThrows(NullPointerException.class, () -> PlaybackCommand.seek(null));
        assertThrows(IllegalArgumentException.class, () -> PlaybackCommand.seek(Duration.ofSeconds(-1)));
        assertEquals(Optional.of(Duration.ofMinutes(2)), PlaybackCommand.seek(Duration.ofMinutes(2)).seekPosition());
    }

    @Test
    void nonSeekCommands_dropPosition() {
        PlaybackCommand pause = new PlaybackCommand(PlaybackCommand.Type.PAUSE, Duration.ofSeconds(5));

        assertTrue(pause.seekPosition().isEmpty());
        assertEquals(PlaybackCommand.pause(), pause);
    }
}

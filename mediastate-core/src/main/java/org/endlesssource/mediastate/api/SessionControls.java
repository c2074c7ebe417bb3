package org.endlesssource.mediastate.api;

import java.time.Duration;

/**
 * Transport controls addressed by stable session key
 */
public interface SessionControls {

    /**
     * Send a command to the session currently published under a key
     * @param sessionKey The stable session key
     * @param command The command to send
     * @throws CommandException if the key is not currently known or delivery failed
     */
    void sendCommand(String sessionKey, PlaybackCommand command) throws CommandException;

    /**
     * Resume playback
     */
    default void play(String sessionKey) throws CommandException {
        sendCommand(sessionKey, PlaybackCommand.play());
    }

    /**
     * Pause playback
     */
    default void pause(String sessionKey) throws CommandException {
        sendCommand(sessionKey, PlaybackCommand.pause());
    }

    /**
     * Stop playback
     */
    default void stop(String sessionKey) throws CommandException {
        sendCommand(sessionKey, PlaybackCommand.stop());
    }

    /**
     * Seek to a specific position
     * @param position The position to seek to
     */
    default void seek(String sessionKey, Duration position) throws CommandException {
        sendCommand(sessionKey, PlaybackCommand.seek(position));
    }
}

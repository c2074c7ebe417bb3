package org.endlesssource.mediastate.api;

/**
 * A playback command could not be delivered.
 */
public class CommandException extends Exception {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.endlesssource.mediastate.api;

/**
 * Delivers playback commands to a server-side session.
 */
public interface CommandTransport {

    /**
     * Send a command
     * @param serverSessionId The server-assigned session id
     * @param command The command to send
     * @throws TransportException if the server rejected or never received the command
     */
    void send(String serverSessionId, PlaybackCommand command) throws TransportException;
}

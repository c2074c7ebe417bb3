package org.endlesssource.mediastate.session;

import org.endlesssource.mediastate.api.CommandException;
import org.endlesssource.mediastate.api.CommandTransport;
import org.endlesssource.mediastate.api.PlaybackCommand;
import org.endlesssource.mediastate.api.SessionControls;
import org.endlesssource.mediastate.api.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Forwards playback commands to the server session behind an entity key.
 * Only checks that the key is currently known.
 */
public final class PlaybackCommander implements SessionControls {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackCommander.class);

    private final SessionIdentityManager identities;
    private final CommandTransport transport;

    public PlaybackCommander(SessionIdentityManager identities, CommandTransport transport) {
        this.identities = Objects.requireNonNull(identities, "identities must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    @Override
    public void sendCommand(String sessionKey, PlaybackCommand command) throws CommandException {
        Objects.requireNonNull(command, "command must not be null");
        String serverSessionId = identities.serverSessionId(sessionKey)
                .orElseThrow(() -> new CommandException("Unknown session: " + sessionKey));
        logger.debug("Sending {} to session {} ({})", command.type(), sessionKey, serverSessionId);
        try {
            transport.send(serverSessionId, command);
        } catch (TransportException ex) {
            throw new CommandException("Failed to send " + command.type() + " to " + sessionKey, ex);
        }
    }
}

package org.endlesssource.mediastate.spi;

import org.endlesssource.mediastate.ProviderSupport;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.ServerConnection;

/**
 * SPI implemented by server-specific modules.
 */
public interface MediaServerProvider {

    /**
     * Stable server type id, e.g. emby.
     */
    String serverType();

    /**
     * Check whether a client can be built for the connection (configuration, runtime prerequisites).
     */
    ProviderSupport probeSupport(ServerConnection connection);

    /**
     * Create a client for the connection.
     */
    MediaServerClient createClient(ServerConnection connection);
}

package org.endlesssource.mediastate.emby;

import org.endlesssource.mediastate.ProviderSupport;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.ServerConnection;
import org.endlesssource.mediastate.spi.MediaServerProvider;

public final class EmbyServerProvider implements MediaServerProvider {
    static final String SERVER_TYPE = "emby";

    @Override
    public String serverType() {
        return SERVER_TYPE;
    }

    @Override
    public ProviderSupport probeSupport(ServerConnection connection) {
        if (connection.apiKey().isBlank()) {
            return ProviderSupport.unavailable(SERVER_TYPE, "An API key is required");
        }
        return ProviderSupport.available(SERVER_TYPE);
    }

    @Override
    public MediaServerClient createClient(ServerConnection connection) {
        return new EmbyClient(connection);
    }
}

package org.endlesssource.mediastate.emby;

import org.endlesssource.mediastate.MediaStateFactory;
import org.endlesssource.mediastate.ProviderSupport;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.ServerConnection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbyServerProviderTest {
    private final EmbyServerProvider provider = new EmbyServerProvider();

    @Test
    void probe_requiresApiKey() {
        ProviderSupport missing = provider.probeSupport(ServerConnection.of("emby.lan", " "));
        assertFalse(missing.available());
        assertEquals("emby", missing.serverType());

        assertTrue(provider.probeSupport(ServerConnection.of("emby.lan", "k3y")).available());
    }

    @Test
    void factory_discoversEmbyProvider() {
        assertTrue(MediaStateFactory.isSupported("emby"));
        assertTrue(MediaStateFactory.getSupportedServerTypes().contains("emby"));
    }

    @Test
    void factory_createsEmbyClient() {
        try (MediaServerClient client = MediaStateFactory.createClient("Emby", ServerConnection.of("emby.lan", "k3y"))) {
            assertInstanceOf(EmbyClient.class, client);
        }
    }

    @Test
    void factory_rejectsMissingApiKey() {
        assertThrows(UnsupportedOperationException.class,
                () -> MediaStateFactory.createClient("emby", ServerConnection.of("emby.lan", "")));
    }
}

package org.endlesssource.mediastate.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConnectionTest {

    @Test
    void fromEnv_readsAllVariables() {
        ServerConnection connection = ServerConnection.fromEnv(Map.of(
                "MEDIA_SERVER_HOST", " emby.lan ",
                "MEDIA_SERVER_PORT", "8920",
                "MEDIA_SERVER_SSL", "true",
                "MEDIA_SERVER_VERIFY_SSL", "false",
                "MEDIA_SERVER_API_KEY", "secret",
                "MEDIA_SERVER_TIMEOUT_SECONDS", "4"));

        assertEquals("emby.lan", connection.host());
        assertEquals(8920, connection.port());
        assertTrue(connection.ssl());
        assertFalse(connection.verifySsl());
        assertEquals("secret", connection.apiKey());
        assertEquals(Duration.ofSeconds(4), connection.requestTimeout());
        assertEquals("https://emby.lan:8920", connection.baseUrl());
    }

    @Test
    void fromEnv_appliesDefaults() {
        ServerConnection connection = ServerConnection.fromEnv(Map.of("MEDIA_SERVER_HOST", "emby.lan"));

        assertEquals(ServerConnection.DEFAULT_PORT, connection.port());
        assertFalse(connection.ssl());
        assertTrue(connection.verifySsl());
        assertEquals("", connection.apiKey());
        assertEquals(ServerConnection.DEFAULT_REQUEST_TIMEOUT, connection.requestTimeout());
        assertEquals("http://emby.lan:8096", connection.baseUrl());
    }

    @Test
    void fromEnv_requiresHostAndNumericPort() {
        assertThrows(IllegalArgumentException.class, () -> ServerConnection.fromEnv(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> ServerConnection.fromEnv(Map.of(
                "MEDIA_SERVER_HOST", "emby.lan", "MEDIA_SERVER_PORT", "http")));
    }

    @Test
    void constructor_validatesFields() {
        assertThrows(IllegalArgumentException.class, () -> ServerConnection.of(" ", "key"));
        assertThrows(IllegalArgumentException.class,
                () -> new ServerConnection("emby.lan", 70000, false, true, "key", null));
        assertThrows(NullPointerException.class, () -> ServerConnection.of("emby.lan", null));
    }

    @Test
    void toString_hidesApiKey() {
        assertFalse(ServerConnection.of("emby.lan", "secret").toString().contains("secret"));
    }
}

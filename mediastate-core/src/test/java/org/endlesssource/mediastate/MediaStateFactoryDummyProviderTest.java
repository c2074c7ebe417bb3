package org.endlesssource.mediastate;

import org.endlesssource.mediastate.api.Category;
import org.endlesssource.mediastate.api.CategoryHealth;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.MediaStateMonitor;
import org.endlesssource.mediastate.api.MonitorOptions;
import org.endlesssource.mediastate.api.ServerConnection;
import org.endlesssource.mediastate.test.DummyMediaServerProvider;
import org.endlesssource.mediastate.test.FakeServerClient;
import org.endlesssource.mediastate.test.RecordingPublisher;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MediaStateFactoryDummyProviderTest {

    @Test
    void createMonitor_nullPublisher_throws() {
        assertThrows(NullPointerException.class,
                () -> MediaStateFactory.createMonitor("test-dummy", ServerConnection.of("den.test", "key"), null));
    }

    @Test
    void createMonitor_usesDummyProvider_andPassesConnection() {
        ServerConnection connection = new ServerConnection("den.test", 8920, true, false, "key", Duration.ofSeconds(3));
        MonitorOptions options = MonitorOptions.defaults().withListSize(3);

        try (MediaStateMonitor monitor = MediaStateFactory.createMonitor("TEST-DUMMY", connection,
                new RecordingPublisher(), options)) {
            assertNotNull(monitor);
            assertEquals(3, monitor.getOptions().getListSize());
            assertEquals(CategoryHealth.OK, monitor.getCategoryStatus().get(Category.SESSIONS).health());
            assertTrue(monitor.getSessions().sessions().isEmpty());
        }

        ServerConnection captured = DummyMediaServerProvider.consumeLastConnection();
        assertNotNull(captured);
        assertEquals(8920, captured.port());
        assertFalse(captured.verifySsl());
        assertEquals(Duration.ofSeconds(3), captured.requestTimeout());
    }

    @Test
    void createClient_unavailableProvider_reportsReason() {
        UnsupportedOperationException ex = assertThrows(UnsupportedOperationException.class,
                () -> MediaStateFactory.createClient("test-dummy", ServerConnection.of("offline.test", "key")));
        assertTrue(ex.getMessage().contains("host is offline"));
    }

    @Test
    void createClient_unknownType_throws() {
        assertThrows(UnsupportedOperationException.class,
                () -> MediaStateFactory.createClient("plex", ServerConnection.of("den.test", "key")));
    }

    @Test
    void createClient_returnsProviderClient() throws Exception {
        try (MediaServerClient client = MediaStateFactory.createClient("test-dummy", ServerConnection.of("den.test", "key"))) {
            assertInstanceOf(FakeServerClient.class, client);
        }
        DummyMediaServerProvider.consumeLastConnection();
    }

    @Test
    void supportedTypes_includeDummyProvider() {
        assertTrue(MediaStateFactory.getSupportedServerTypes().contains("test-dummy"));
        assertTrue(MediaStateFactory.isSupported("Test-Dummy"));
        assertFalse(MediaStateFactory.isSupported(null));
    }
}

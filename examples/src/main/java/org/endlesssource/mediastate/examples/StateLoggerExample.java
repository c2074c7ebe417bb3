package org.endlesssource.mediastate.examples;

import org.endlesssource.mediastate.MediaStateFactory;
import org.endlesssource.mediastate.api.EntityKind;
import org.endlesssource.mediastate.api.MediaStateMonitor;
import org.endlesssource.mediastate.api.MonitorOptions;
import org.endlesssource.mediastate.api.Publisher;
import org.endlesssource.mediastate.api.ServerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Logs every entity update. Reads the connection from {@code MEDIA_SERVER_*} variables.
 */
public final class StateLoggerExample {
    private static final Logger logger = LoggerFactory.getLogger(StateLoggerExample.class);

    public static void main(String[] args) {
        if (!MediaStateFactory.isSupported("emby")) {
            throw new IllegalStateException("Emby provider not on the classpath");
        }

        ServerConnection connection = ServerConnection.fromEnv();
        try (MediaStateMonitor monitor = MediaStateFactory.createMonitor("emby", connection, new LoggingPublisher(),
                MonitorOptions.defaults())) {
            monitor.start();
            while (true) {
                Thread.sleep(60_000);
                monitor.getCategoryStatus().values()
                        .forEach(status -> logger.info("{}: {} (failures={})", status.category().id(), status.health(),
                                status.consecutiveFailures()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(0);
        }
    }

    private static final class LoggingPublisher implements Publisher {
        @Override
        public void publish(EntityKind kind, String key, Object state, Map<String, Object> attributes) {
            if (kind == EntityKind.SESSION) {
                logger.info("[{}] {} | {} | {}", key, state,
                        attributes.getOrDefault("media_title", attributes.getOrDefault("media_channel", "-")),
                        attributes.getOrDefault("playback_method", "-"));
            } else {
                logger.info("[{}] {} {}", key, state, attributes);
            }
        }

        @Override
        public void markUnavailable(EntityKind kind, String key, Instant lastUpdated) {
            logger.warn("[{}] unavailable, last updated {}", key, lastUpdated);
        }

        @Override
        public void remove(EntityKind kind, String key) {
            logger.info("[{}] removed", key);
        }
    }

    private StateLoggerExample() {
    }
}

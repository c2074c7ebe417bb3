package org.endlesssource.mediastate;

import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.MediaStateMonitor;
import org.endlesssource.mediastate.api.MonitorOptions;
import org.endlesssource.mediastate.api.Publisher;
import org.endlesssource.mediastate.api.ServerConnection;
import org.endlesssource.mediastate.poll.PollingMediaStateMonitor;
import org.endlesssource.mediastate.spi.MediaServerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class MediaStateFactory {
    private static final Logger logger = LoggerFactory.getLogger(MediaStateFactory.class);

    private MediaStateFactory() {}

    /**
     * Create a monitor with default options
     * @throws UnsupportedOperationException if no available provider handles the server type
     */
    public static MediaStateMonitor createMonitor(String serverType, ServerConnection connection, Publisher publisher) {
        return createMonitor(serverType, connection, publisher, MonitorOptions.defaults());
    }

    /**
     * Create a monitor for a media server. The monitor is not started.
     * @param serverType Server type id, e.g. emby
     * @param connection Where to reach the server
     * @param publisher Receiver of derived state
     * @param options Monitor options
     * @return A monitor ready to {@link MediaStateMonitor#start()}
     * @throws UnsupportedOperationException if no available provider handles the server type
     */
    public static MediaStateMonitor createMonitor(String serverType,
                                                  ServerConnection connection,
                                                  Publisher publisher,
                                                  MonitorOptions options) {
        Objects.requireNonNull(publisher, "publisher must not be null");
        Objects.requireNonNull(options, "options must not be null");
        MediaServerClient client = createClient(serverType, connection);
        return new PollingMediaStateMonitor(client, publisher, options);
    }

    /**
     * Create a bare client for a media server
     * @throws UnsupportedOperationException if no available provider handles the server type
     */
    public static MediaServerClient createClient(String serverType, ServerConnection connection) {
        Objects.requireNonNull(serverType, "serverType must not be null");
        Objects.requireNonNull(connection, "connection must not be null");
        String type = serverType.toLowerCase(Locale.ROOT);
        List<MediaServerProvider> candidates = loadProviders().stream()
                .filter(provider -> provider.serverType().equalsIgnoreCase(type))
                .toList();
        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No provider module found for server type: " + serverType);
        }

        List<String> reasons = new ArrayList<>();
        for (MediaServerProvider provider : candidates) {
            ProviderSupport support = provider.probeSupport(connection);
            if (support.available()) {
                logger.info("Using {} provider for {}", provider.serverType(), connection);
                return provider.createClient(connection);
            }
            reasons.add(provider.serverType() + ": " + support.reason());
        }
        throw new UnsupportedOperationException("Server type is not available: " + String.join("; ", reasons));
    }

    /**
     * Server types with a provider on the classpath.
     */
    public static List<String> getSupportedServerTypes() {
        return loadProviders().stream()
                .map(MediaServerProvider::serverType)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    public static boolean isSupported(String serverType) {
        return serverType != null && getSupportedServerTypes().stream().anyMatch(serverType::equalsIgnoreCase);
    }

    private static List<MediaServerProvider> loadProviders() {
        ServiceLoader<MediaServerProvider> loader = ServiceLoader.load(MediaServerProvider.class);
        List<MediaServerProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered media server providers: {}",
                    providers.stream().map(MediaServerProvider::serverType).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}

package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how to reach the media server.
 */
public record ServerConnection(String host,
                               int port,
                               boolean ssl,
                               boolean verifySsl,
                               String apiKey,
                               Duration requestTimeout) {
    public static final int DEFAULT_PORT = 8096;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public ServerConnection {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        Objects.requireNonNull(apiKey, "apiKey must not be null");
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static ServerConnection of(String host, String apiKey) {
        return new ServerConnection(host, DEFAULT_PORT, false, true, apiKey, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Read the connection from {@code MEDIA_SERVER_*} environment variables.
     */
    public static ServerConnection fromEnv() {
        return fromEnv(System.getenv());
    }

    static ServerConnection fromEnv(Map<String, String> env) {
        String host = env.get("MEDIA_SERVER_HOST");
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("MEDIA_SERVER_HOST is required");
        }
        String apiKey = env.getOrDefault("MEDIA_SERVER_API_KEY", "");
        int port = parseInt(env.get("MEDIA_SERVER_PORT"), DEFAULT_PORT, "MEDIA_SERVER_PORT");
        boolean ssl = Boolean.parseBoolean(env.getOrDefault("MEDIA_SERVER_SSL", "false"));
        boolean verifySsl = Boolean.parseBoolean(env.getOrDefault("MEDIA_SERVER_VERIFY_SSL", "true"));
        int timeoutSeconds = parseInt(env.get("MEDIA_SERVER_TIMEOUT_SECONDS"),
                (int) DEFAULT_REQUEST_TIMEOUT.toSeconds(), "MEDIA_SERVER_TIMEOUT_SECONDS");
        return new ServerConnection(host.trim(), port, ssl, verifySsl, apiKey, Duration.ofSeconds(timeoutSeconds));
    }

    public String baseUrl() {
        return (ssl ? "https" : "http") + "://" + host + ":" + port;
    }

    private static int parseInt(String raw, int fallback, String name) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number: " + raw, ex);
        }
    }

    @Override
    public String toString() {
        return "ServerConnection[" + baseUrl() + ", verifySsl=" + verifySsl + "]";
    }
}

package org.endlesssource.mediastate.emby;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.PlaybackCommand;
import org.endlesssource.mediastate.api.ServerConnection;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.raw.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Emby REST client. Authenticates with the API key header and maps HTTP failures
 * onto {@link TransportException} kinds.
 */
public final class EmbyClient implements MediaServerClient {
    private static final Logger logger = LoggerFactory.getLogger(EmbyClient.class);
    static final String TOKEN_HEADER = "X-Emby-Token";
    static final int DEFAULT_LIST_LIMIT = 5;

    private final ServerConnection connection;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Clock clock;
    private volatile String userId;
    private volatile boolean closed;

    public EmbyClient(ServerConnection connection) {
        this(connection, buildHttpClient(connection), new ObjectMapper(), Clock.systemUTC());
    }

    EmbyClient(ServerConnection connection, HttpClient http, ObjectMapper mapper, Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JsonNode fetch(Endpoint endpoint, Map<String, String> params) throws TransportException {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Map<String, String> args = params == null ? Map.of() : params;
        return switch (endpoint) {
            case SESSIONS -> fetchSessions();
            case PROGRAM -> get(EmbyPaths.program(require(args, Endpoint.PARAM_ID), resolveUserId().orElse(null)));
            case CHANNEL_GUIDE -> fetchAiring(require(args, Endpoint.PARAM_CHANNEL_ID));
            case CHANNEL -> get(EmbyPaths.channel(require(args, Endpoint.PARAM_ID)));
            case ACTIVITY_LOG -> get(EmbyPaths.activityLog());
            case SYSTEM_INFO -> get(EmbyPaths.systemInfo());
            case TIMERS -> get(EmbyPaths.timers(resolveUserId().orElse(null)));
            case ACTIVE_RECORDINGS -> get(EmbyPaths.activeRecordings());
            case SERIES_TIMERS -> get(EmbyPaths.seriesTimers(resolveUserId().orElse(null)));
            case ITEM_COUNTS -> get(EmbyPaths.itemCounts(requireUserId()));
            case LIBRARY_VIEWS -> get(EmbyPaths.views(requireUserId()));
            case LATEST_MOVIES -> get(EmbyPaths.latestItems(requireUserId(), "Movie", limit(args) * 2));
            case LATEST_EPISODES -> get(EmbyPaths.latestItems(requireUserId(), "Episode", limit(args) * 2));
            case UPCOMING_EPISODES -> fetchUpcoming(limit(args));
        };
    }

    @Override
    public void send(String serverSessionId, PlaybackCommand command) throws TransportException {
        Objects.requireNonNull(serverSessionId, "serverSessionId must not be null");
        Objects.requireNonNull(command, "command must not be null");
        post(EmbyPaths.command(serverSessionId, command));
    }

    @Override
    public String itemImage(String itemId) {
        return connection.baseUrl() + EmbyPaths.itemImage(itemId) + "?api_key=" + EmbyPaths.encode(connection.apiKey());
    }

    @Override
    public String userImage(String userId) {
        return connection.baseUrl() + EmbyPaths.userImage(userId) + "?api_key=" + EmbyPaths.encode(connection.apiKey());
    }

    /**
     * User id for user-scoped endpoints: the key's own user, else the first administrator,
     * else the first user. Cached once found.
     * @throws TransportException only when credentials are rejected
     */
    public Optional<String> resolveUserId() throws TransportException {
        String cached = userId;
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> resolved = quietly(() -> JsonFields.text(get(EmbyPaths.currentUser()), "Id"));
        if (resolved.isEmpty()) {
            resolved = quietly(() -> pickUser(get(EmbyPaths.users())));
        }
        resolved.ifPresent(id -> {
            userId = id;
            logger.debug("Resolved Emby user id {}", id);
        });
        return resolved;
    }

    @Override
    public void close() {
        closed = true;
    }

    private JsonNode fetchSessions() throws TransportException {
        JsonNode sessions = get(EmbyPaths.sessions());
        int count = JsonFields.items(sessions).size();
        if (count <= 1) {
            Optional<String> user = resolveUserId();
            if (user.isPresent()) {
                JsonNode controllable = get(EmbyPaths.sessionsControllableBy(user.get()));
                if (JsonFields.items(controllable).size() > count) {
                    logger.debug("Using sessions controllable by user {}", user.get());
                    return controllable;
                }
            }
        }
        return sessions;
    }

    private JsonNode fetchAiring(String channelId) throws TransportException {
        String user = resolveUserId().orElse(null);
        JsonNode airing = get(EmbyPaths.airingPrograms(channelId, user));
        if (!JsonFields.items(airing).isEmpty()) {
            return airing;
        }
        return get(EmbyPaths.channelAiringPrograms(channelId, user));
    }

    private JsonNode fetchUpcoming(int limit) throws TransportException {
        String user = requireUserId();
        JsonNode upcoming = get(EmbyPaths.upcomingEpisodes(user, limit * 8));
        if (!JsonFields.items(upcoming).isEmpty()) {
            return upcoming;
        }
        return get(EmbyPaths.unairedEpisodes(user, limit * 12, clock.instant()));
    }

    JsonNode get(String path) throws TransportException {
        return exchange(request(path).GET().build());
    }

    JsonNode post(String path) throws TransportException {
        HttpRequest request = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
        return exchange(request);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(connection.baseUrl() + path))
                .timeout(connection.requestTimeout())
                .header("Accept", "application/json");
        if (!connection.apiKey().isEmpty()) {
            builder.header(TOKEN_HEADER, connection.apiKey());
        }
        return builder;
    }

    private JsonNode exchange(HttpRequest request) throws TransportException {
        if (closed) {
            throw new TransportException(TransportException.Kind.UNREACHABLE, "Client is closed");
        }
        String target = request.method() + " " + request.uri().getPath();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException ex) {
            throw new TransportException(TransportException.Kind.TIMEOUT, target + " timed out", ex);
        } catch (IOException ex) {
            throw new TransportException(TransportException.Kind.UNREACHABLE, target + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.TIMEOUT, target + " interrupted", ex);
        }

        int status = response.statusCode();
        if (status == 401) {
            throw new TransportException(TransportException.Kind.UNAUTHORIZED, target + " unauthorized");
        }
        if (status >= 500) {
            throw new TransportException(TransportException.Kind.UNREACHABLE, target + " returned HTTP " + status);
        }
        if (status >= 400) {
            throw new TransportException(TransportException.Kind.MALFORMED, target + " returned HTTP " + status);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new TransportException(TransportException.Kind.MALFORMED, target + " returned invalid JSON", ex);
        }
    }

    private String require(Map<String, String> params, String name) throws TransportException {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            throw new TransportException(TransportException.Kind.MALFORMED, "Missing parameter: " + name);
        }
        return value;
    }

    private String requireUserId() throws TransportException {
        return resolveUserId().orElseThrow(() ->
                new TransportException(TransportException.Kind.MALFORMED, "No Emby user available"));
    }

    private static int limit(Map<String, String> params) {
        String raw = params.get(Endpoint.PARAM_LIMIT);
        if (raw == null) {
            return DEFAULT_LIST_LIMIT;
        }
        try {
            return Math.max(1, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return DEFAULT_LIST_LIMIT;
        }
    }

    static Optional<String> pickUser(JsonNode users) {
        List<JsonNode> all = JsonFields.items(users);
        return all.stream()
                .filter(user -> JsonFields.object(user, "Policy")
                        .map(policy -> JsonFields.flag(policy, "IsAdministrator"))
                        .orElse(false))
                .findFirst()
                .or(() -> all.stream().findFirst())
                .flatMap(user -> JsonFields.text(user, "Id"));
    }

    private Optional<String> quietly(UserLookup lookup) throws TransportException {
        try {
            return lookup.find();
        } catch (TransportException ex) {
            if (ex.isUnauthorized()) {
                throw ex;
            }
            logger.debug("User lookup failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface UserLookup {
        Optional<String> find() throws TransportException;
    }

    private static HttpClient buildHttpClient(ServerConnection connection) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connection.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (connection.ssl() && !connection.verifySsl()) {
            logger.warn("Certificate verification disabled for {}", connection.host());
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to initialise TLS context", ex);
        }
    }
}

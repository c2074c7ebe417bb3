package org.endlesssource.mediastate.emby;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP server answering canned Emby responses. Routes match on path and an optional
 * query fragment; the first registered match wins.
 */
final class StubEmbyServer implements AutoCloseable {
    private final HttpServer server;
    private boolean stopped;
    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    StubEmbyServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    int port() {
        return server.getAddress().getPort();
    }

    StubEmbyServer on(String path, int status, String body) {
        return on(path, null, status, body);
    }

    StubEmbyServer on(String path, String queryFragment, int status, String body) {
        routes.add(new Route(path, queryFragment, status, body.replace('\'', '"')));
        return this;
    }

    List<Request> requests() {
        return new ArrayList<>(requests);
    }

    List<Request> requestsTo(String path) {
        return requests.stream().filter(request -> request.path().equals(path)).toList();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(new Request(exchange.getRequestMethod(), path, query == null ? "" : query,
                exchange.getRequestHeaders().getFirst(EmbyClient.TOKEN_HEADER)));

        Route route = routes.stream()
                .filter(candidate -> candidate.matches(path, query))
                .findFirst()
                .orElse(new Route(path, null, 404, ""));
        byte[] body = route.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(route.status(), body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @Override
    public void close() {
        if (!stopped) {
            stopped = true;
            server.stop(0);
        }
    }

    record Request(String method, String path, String query, String token) {
    }

    private record Route(String path, String queryFragment, int status, String body) {
        boolean matches(String requestPath, String query) {
            if (!path.equals(requestPath)) {
                return false;
            }
            return queryFragment == null || (query != null && query.contains(queryFragment));
        }
    }
}

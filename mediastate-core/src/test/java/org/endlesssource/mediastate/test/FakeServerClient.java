package org.endlesssource.mediastate.test;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.PlaybackCommand;
import org.endlesssource.mediastate.api.TransportException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted client. Each endpoint answers from a queue of responses; the last one repeats.
 * Scripting an endpoint again replaces its queue. Responses may also be keyed by endpoint
 * plus one parameter value.
 */
public final class FakeServerClient implements MediaServerClient {
    public static final String IMAGE_BASE = "http://emby.test";

    private final Map<String, Deque<Object>> responses = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<SentCommand> commands = new CopyOnWriteArrayList<>();
    private volatile Duration delay = Duration.ZERO;
    private volatile TransportException commandFailure;
    private volatile boolean closed;

    public FakeServerClient respond(Endpoint endpoint, JsonNode... payloads) {
        enqueue(endpoint.name(), payloads);
        return this;
    }

    public FakeServerClient respond(Endpoint endpoint, String param, JsonNode... payloads) {
        enqueue(endpoint.name() + ":" + param, payloads);
        return this;
    }

    public FakeServerClient fail(Endpoint endpoint, TransportException.Kind kind) {
        responses.put(endpoint.name(), new ArrayDeque<>(List.of(
                new TransportException(kind, endpoint + " " + kind))));
        return this;
    }

    public FakeServerClient fail(Endpoint endpoint, String param, TransportException.Kind kind) {
        responses.put(endpoint.name() + ":" + param, new ArrayDeque<>(List.of(
                new TransportException(kind, endpoint + " " + kind))));
        return this;
    }

    public FakeServerClient delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public FakeServerClient failCommands(TransportException failure) {
        this.commandFailure = failure;
        return this;
    }

    @Override
    public JsonNode fetch(Endpoint endpoint, Map<String, String> params) throws TransportException {
        calls.add(endpoint.name());
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportException.Kind.TIMEOUT, "interrupted", ex);
            }
        }
        for (String value : params.values()) {
            Deque<Object> keyed = responses.get(endpoint.name() + ":" + value);
            if (keyed != null) {
                return answer(keyed);
            }
        }
        Deque<Object> queue = responses.get(endpoint.name());
        if (queue == null) {
            throw new TransportException(TransportException.Kind.MALFORMED, "No response scripted for " + endpoint);
        }
        return answer(queue);
    }

    @Override
    public void send(String serverSessionId, PlaybackCommand command) throws TransportException {
        if (commandFailure != null) {
            throw commandFailure;
        }
        commands.add(new SentCommand(serverSessionId, command));
    }

    @Override
    public String itemImage(String itemId) {
        return IMAGE_BASE + "/Items/" + itemId + "/Images/Primary";
    }

    @Override
    public String userImage(String userId) {
        return IMAGE_BASE + "/Users/" + userId + "/Images/Primary";
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    public long callCount(Endpoint endpoint) {
        return calls.stream().filter(endpoint.name()::equals).count();
    }

    public List<SentCommand> commands() {
        return new ArrayList<>(commands);
    }

    public boolean isClosed() {
        return closed;
    }

    private void enqueue(String key, JsonNode... payloads) {
        responses.put(key, new ArrayDeque<>(List.of(payloads)));
    }

    private static JsonNode answer(Deque<Object> queue) throws TransportException {
        Object next;
        synchronized (queue) {
            next = queue.size() > 1 ? queue.poll() : queue.peek();
        }
        if (next instanceof TransportException failure) {
            throw failure;
        }
        return (JsonNode) next;
    }

    public record SentCommand(String serverSessionId, PlaybackCommand command) {
    }
}

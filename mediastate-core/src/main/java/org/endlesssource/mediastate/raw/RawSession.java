package org.endlesssource.mediastate.raw;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over one entry of the sessions payload.
 * Lives only for the poll cycle that fetched it.
 */
public final class RawSession {
    private static final JsonNode EMPTY = JsonNodeFactory.instance.objectNode();

    private final JsonNode node;

    public RawSession(JsonNode node) {
        this.node = Objects.requireNonNull(node, "node must not be null");
    }

    public static List<RawSession> listOf(JsonNode payload) {
        List<RawSession> sessions = new ArrayList<>();
        for (JsonNode item : JsonFields.items(payload)) {
            sessions.add(new RawSession(item));
        }
        return sessions;
    }

    public Optional<String> id() {
        return JsonFields.text(node, "Id", "SessionId");
    }

    public Optional<String> deviceId() {
        return JsonFields.text(node, "DeviceId");
    }

    public Optional<String> deviceName() {
        return JsonFields.text(node, "DeviceName", "Client");
    }

    public Optional<String> userId() {
        return JsonFields.text(node, "UserId");
    }

    public Optional<String> userName() {
        return JsonFields.text(node, "UserName");
    }

    public Optional<String> appName() {
        return JsonFields.text(node, "Client", "Application");
    }

    /**
     * The now-playing item, empty when the session is idle.
     */
    public Optional<JsonNode> nowPlaying() {
        return JsonFields.object(node, "NowPlayingItem");
    }

    public Optional<JsonNode> nowPlayingProgram() {
        return JsonFields.object(node, "NowPlayingProgram");
    }

    public Optional<String> nowPlayingProgramId() {
        return JsonFields.text(node, "NowPlayingProgramId");
    }

    /**
     * The play state block, or an empty object when none was reported.
     */
    public JsonNode playState() {
        return JsonFields.object(node, "PlayState").orElse(EMPTY);
    }

    public boolean hasPlayState() {
        return JsonFields.object(node, "PlayState").isPresent();
    }

    /**
     * Transcoding block from the session or, failing that, from its play state.
     */
    public Optional<JsonNode> transcodingInfo() {
        return JsonFields.object(node, "TranscodingInfo")
                .or(() -> JsonFields.object(playState(), "TranscodingInfo"));
    }

    public JsonNode node() {
        return node;
    }
}

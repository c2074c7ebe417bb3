package org.endlesssource.mediastate.test;

import org.endlesssource.mediastate.api.EntityKind;
import org.endlesssource.mediastate.api.Publisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps the latest state per entity and a log of removals and unavailability marks.
 */
public final class RecordingPublisher implements Publisher {
    private final Map<String, Entity> entities = new ConcurrentHashMap<>();
    private final List<String> removed = new CopyOnWriteArrayList<>();
    private final Map<String, Instant> unavailable = new ConcurrentHashMap<>();
    private final List<String> publishLog = new CopyOnWriteArrayList<>();

    @Override
    public void publish(EntityKind kind, String key, Object state, Map<String, Object> attributes) {
        entities.put(key, new Entity(kind, key, state, Map.copyOf(attributes)));
        unavailable.remove(key);
        publishLog.add(key);
    }

    @Override
    public void markUnavailable(EntityKind kind, String key, Instant lastUpdated) {
        unavailable.put(key, lastUpdated == null ? Instant.EPOCH : lastUpdated);
    }

    @Override
    public void remove(EntityKind kind, String key) {
        entities.remove(key);
        removed.add(key);
    }

    public Optional<Entity> entity(String key) {
        return Optional.ofNullable(entities.get(key));
    }

    public Entity require(String key) {
        Entity entity = entities.get(key);
        if (entity == null) {
            throw new AssertionError("No entity published under " + key + ", have " + entities.keySet());
        }
        return entity;
    }

    public List<Entity> ofKind(EntityKind kind) {
        return entities.values().stream().filter(entity -> entity.kind() == kind).toList();
    }

    public List<String> removed() {
        return new ArrayList<>(removed);
    }

    public Map<String, Instant> unavailable() {
        return Map.copyOf(unavailable);
    }

    public long publishCount(String key) {
        return publishLog.stream().filter(key::equals).count();
    }

    public record Entity(EntityKind kind, String key, Object state, Map<String, Object> attributes) {
        public Object attribute(String name) {
            return attributes.get(name);
        }
    }
}

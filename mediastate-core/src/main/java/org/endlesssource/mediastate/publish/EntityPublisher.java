package org.endlesssource.mediastate.publish;

import org.endlesssource.mediastate.aggregate.ActiveStreams;
import org.endlesssource.mediastate.aggregate.BandwidthUsage;
import org.endlesssource.mediastate.aggregate.MultisessionUsers;
import org.endlesssource.mediastate.aggregate.ServerStats;
import org.endlesssource.mediastate.aggregate.StreamBandwidth;
import org.endlesssource.mediastate.aggregate.TranscodeDetail;
import org.endlesssource.mediastate.aggregate.TranscodingLoad;
import org.endlesssource.mediastate.aggregate.UserSessions;
import org.endlesssource.mediastate.api.ActivityEntry;
import org.endlesssource.mediastate.api.EntityKind;
import org.endlesssource.mediastate.api.Feature;
import org.endlesssource.mediastate.api.LibraryItem;
import org.endlesssource.mediastate.api.LibraryStats;
import org.endlesssource.mediastate.api.Publisher;
import org.endlesssource.mediastate.api.Recording;
import org.endlesssource.mediastate.api.RecordingsSnapshot;
import org.endlesssource.mediastate.api.SessionSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns engine results into entity updates on a {@link Publisher}.
 * Aggregate entities are keyed {@code <prefix>_<kind>}.
 */
public final class EntityPublisher {
    private static final double BITS_PER_MEGABIT = 1_000_000.0d;

    private final Publisher publisher;
    private final String keyPrefix;

    public EntityPublisher(Publisher publisher, String keyPrefix) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
    }

    public String aggregateKey(EntityKind kind) {
        return keyPrefix.isEmpty() ? kind.id() : keyPrefix + "_" + kind.id();
    }

    public void publishSessions(SessionSnapshot snapshot) {
        for (String key : snapshot.removed()) {
            publisher.remove(EntityKind.SESSION, key);
        }
        snapshot.sessions().forEach((key, session) ->
                publisher.publish(EntityKind.SESSION, key, session.state().id(), SessionAttributes.of(session)));
    }

    public void publishActiveStreams(ActiveStreams streams) {
        publishAggregate(EntityKind.ACTIVE_STREAMS, streams.count(), new Attributes()
                .put("users", String.join(", ", streams.users()))
                .put("total_sessions", streams.totalSessions())
                .build());
    }

    public void publishBandwidth(BandwidthUsage usage) {
        List<Map<String, Object>> streams = usage.streams().stream()
                .map(EntityPublisher::streamAttributes)
                .toList();
        publishAggregate(EntityKind.BANDWIDTH, usage.megabytesPerSecond(), new Attributes()
                .put("unit", "MB/s")
                .put("total_bitrate_mbps", toMbps(usage.totalBps()))
                .put("active_streams", streams.size())
                .put("streams", streams)
                .build());
    }

    public void publishTranscodingLoad(TranscodingLoad load) {
        List<Map<String, Object>> sessions = load.details().stream()
                .map(EntityPublisher::transcodeAttributes)
                .toList();
        publishAggregate(EntityKind.TRANSCODING, load.percent(), new Attributes()
                .put("session_count", load.transcodingCount())
                .put("active_streams", load.activeCount())
                .put("transcoding_sessions", sessions)
                .build());
    }

    public void publishMultisessionUsers(MultisessionUsers users) {
        List<Map<String, Object>> details = users.users().stream()
                .map(EntityPublisher::userAttributes)
                .toList();
        publishAggregate(EntityKind.MULTISESSION_USERS, users.count(), new Attributes()
                .put("users", details)
                .build());
    }

    public void publishServerStats(ServerStats stats) {
        List<Map<String, Object>> activities = stats.recentActivity().stream()
                .map(EntityPublisher::activityAttributes)
                .toList();
        publishAggregate(EntityKind.SERVER_STATS, stats.activeSessions(), new Attributes()
                .put("server_name", stats.serverInfo().serverName())
                .put("version", stats.serverInfo().version())
                .put("operating_system", stats.serverInfo().operatingSystem())
                .put("architecture", stats.serverInfo().architecture())
                .put("active_sessions", stats.activeSessions())
                .put("total_sessions", stats.totalSessions())
                .put("unique_users", stats.uniqueUsers())
                .put("unique_devices", stats.uniqueDevices())
                .put("content_types", stats.contentTypes())
                .put("recent_activities", activities)
                .build());
    }

    public void publishRecordings(RecordingsSnapshot recordings) {
        publishAggregate(EntityKind.RECORDINGS, recordings.active().size(), new Attributes()
                .put("active_recordings", recordingAttributes(recordings.active()))
                .put("scheduled_recordings", recordingAttributes(recordings.scheduled()))
                .put("series_recordings", recordingAttributes(recordings.series()))
                .put("active_count", recordings.active().size())
                .put("scheduled_count", recordings.scheduled().size())
                .put("series_count", recordings.series().size())
                .build());
    }

    public void publishLibraryStats(LibraryStats stats) {
        Attributes attributes = new Attributes();
        stats.counts().forEach((name, count) -> attributes.put("total_" + name, count));
        attributes.put("last_updated", stats.lastUpdated());
        publishAggregate(EntityKind.LIBRARY_STATS, stats.libraryCount(), attributes.build());
    }

    public void publishLibraryList(Feature feature, List<LibraryItem> items) {
        List<Map<String, Object>> entries = items.stream()
                .map(EntityPublisher::itemAttributes)
                .toList();
        publisher.publish(listKind(feature), aggregateKey(listKind(feature)), items.size(),
                Map.of("items", entries));
    }

    public void markUnavailable(EntityKind kind, Instant lastSuccess) {
        publisher.markUnavailable(kind, aggregateKey(kind), lastSuccess);
    }

    public void markSessionUnavailable(String key, Instant lastSuccess) {
        publisher.markUnavailable(EntityKind.SESSION, key, lastSuccess);
    }

    public void remove(EntityKind kind) {
        publisher.remove(kind, aggregateKey(kind));
    }

    public void removeSession(String key) {
        publisher.remove(EntityKind.SESSION, key);
    }

    /**
     * Entity kind behind a feature toggle.
     */
    public static EntityKind entityKind(Feature feature) {
        return switch (feature) {
            case RECORDINGS -> EntityKind.RECORDINGS;
            case ACTIVE_STREAMS -> EntityKind.ACTIVE_STREAMS;
            case MULTISESSION -> EntityKind.MULTISESSION_USERS;
            case BANDWIDTH -> EntityKind.BANDWIDTH;
            case TRANSCODING_LOAD -> EntityKind.TRANSCODING;
            case SERVER_STATS -> EntityKind.SERVER_STATS;
            case LIBRARY_STATS -> EntityKind.LIBRARY_STATS;
            case LATEST_MOVIES -> EntityKind.LATEST_MOVIES;
            case LATEST_EPISODES -> EntityKind.LATEST_EPISODES;
            case UPCOMING_EPISODES -> EntityKind.UPCOMING_EPISODES;
        };
    }

    private static EntityKind listKind(Feature feature) {
        EntityKind kind = entityKind(feature);
        if (kind != EntityKind.LATEST_MOVIES && kind != EntityKind.LATEST_EPISODES
                && kind != EntityKind.UPCOMING_EPISODES) {
            throw new IllegalArgumentException("Not a library list: " + feature);
        }
        return kind;
    }

    private void publishAggregate(EntityKind kind, Object state, Map<String, Object> attributes) {
        publisher.publish(kind, aggregateKey(kind), state, attributes);
    }

    private static Map<String, Object> streamAttributes(StreamBandwidth stream) {
        return new Attributes()
                .put("user", stream.user())
                .put("device", stream.device())
                .put("media", stream.media())
                .put("video_bitrate_mbps", toMbps(stream.videoBps()))
                .put("audio_bitrate_mbps", toMbps(stream.audioBps()))
                .put("total_bitrate_mbps", toMbps(stream.totalBps()))
                .build();
    }

    private static Map<String, Object> transcodeAttributes(TranscodeDetail detail) {
        return new Attributes()
                .put("user", detail.user())
                .put("device", detail.device())
                .put("media", detail.media())
                .put("video_codec", detail.videoCodec())
                .put("audio_codec", detail.audioCodec())
                .put("bitrate", detail.bitrate())
                .put("reasons", detail.reasons())
                .build();
    }

    private static Map<String, Object> userAttributes(UserSessions user) {
        return new Attributes()
                .put("user", user.user())
                .put("count", user.count())
                .put("devices", user.devices().stream().sorted().toList())
                .build();
    }

    private static Map<String, Object> activityAttributes(ActivityEntry entry) {
        return new Attributes()
                .put("date", entry.date())
                .put("user", entry.user())
                .put("name", entry.name())
                .put("type", entry.type())
                .build();
    }

    private static List<Map<String, Object>> recordingAttributes(List<Recording> recordings) {
        return recordings.stream()
                .map(recording -> {
                    Attributes attributes = new Attributes()
                            .put("name", recording.name())
                            .put("channel", recording.channel())
                            .put("start_time", recording.start())
                            .put("end_time", recording.end());
                    if (recording.rule() != null) {
                        attributes.put("record_any_time", recording.rule().recordAnyTime())
                                .put("record_any_channel", recording.rule().recordAnyChannel())
                                .put("days", recording.rule().days());
                    }
                    return attributes.build();
                })
                .toList();
    }

    private static Map<String, Object> itemAttributes(LibraryItem item) {
        return new Attributes()
                .put("id", item.id())
                .put("title", item.title())
                .put("series", item.seriesTitle())
                .put("season", item.season())
                .put("episode", item.episode())
                .put("premiere_date", item.premiereDate())
                .put("runtime", item.runtime() == null ? null : item.runtime().toSeconds())
                .put("rating", item.rating())
                .put("genres", item.genres())
                .put("image", item.imageUrl())
                .build();
    }

    static double toMbps(long bitsPerSecond) {
        return Math.round(bitsPerSecond / BITS_PER_MEGABIT * 100.0d) / 100.0d;
    }
}

package org.endlesssource.mediastate.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.ActivityEntry;
import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.SessionSnapshot;
import org.endlesssource.mediastate.raw.JsonFields;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cross-session aggregates over one session snapshot. Stateless; a session
 * missing a field only drops out of the figure that needs it.
 */
public final class AggregationEngine {
    public static final int RECENT_ACTIVITY_LIMIT = 5;
    static final String UNKNOWN_USER = "Unknown";
    private static final double BYTES_PER_MEGABYTE = 1024.0d * 1024.0d;

    public ActiveStreams activeStreams(SessionSnapshot snapshot) {
        Set<String> users = new TreeSet<>();
        int count = 0;
        for (ClassifiedSession session : snapshot.sessions().values()) {
            if (session.isActiveStream()) {
                count++;
                users.add(userLabel(session));
            }
        }
        return new ActiveStreams(count, snapshot.sessions().size(), new ArrayList<>(users));
    }

    public BandwidthUsage bandwidth(SessionSnapshot snapshot) {
        List<StreamBandwidth> streams = new ArrayList<>();
        long total = 0L;
        for (Map.Entry<String, ClassifiedSession> entry : snapshot.sessions().entrySet()) {
            ClassifiedSession session = entry.getValue();
            if (!session.isActiveStream()) {
                continue;
            }
            long bps = session.bandwidth().totalBps();
            total += bps;
            streams.add(new StreamBandwidth(entry.getKey(), userLabel(session), deviceLabel(session),
                    session.mediaName(), session.bandwidth().videoBps(), session.bandwidth().audioBps(), bps));
        }
        return new BandwidthUsage(toMegabytesPerSecond(total), total, streams);
    }

    public TranscodingLoad transcodingLoad(SessionSnapshot snapshot) {
        List<TranscodeDetail> details = new ArrayList<>();
        int active = 0;
        for (Map.Entry<String, ClassifiedSession> entry : snapshot.sessions().entrySet()) {
            ClassifiedSession session = entry.getValue();
            if (!session.isActiveStream()) {
                continue;
            }
            active++;
            if (session.transcode().isTranscoding()) {
                details.add(new TranscodeDetail(entry.getKey(), userLabel(session), deviceLabel(session),
                        session.mediaName(), session.transcode().videoCodec(), session.transcode().audioCodec(),
                        session.transcode().bitrate(), session.transcode().reasons()));
            }
        }
        double percent = active == 0 ? 0.0d : round(details.size() * 100.0d / active, 10.0d);
        return new TranscodingLoad(percent, details.size(), active, details);
    }

    public MultisessionUsers multisessionUsers(SessionSnapshot snapshot) {
        Map<String, List<ClassifiedSession>> byUser = new TreeMap<>();
        for (ClassifiedSession session : snapshot.sessions().values()) {
            if (session.isActiveStream()) {
                byUser.computeIfAbsent(userLabel(session), user -> new ArrayList<>()).add(session);
            }
        }
        List<UserSessions> users = new ArrayList<>();
        byUser.forEach((user, sessions) -> {
            if (sessions.size() >= 2) {
                Set<String> devices = new TreeSet<>();
                sessions.forEach(session -> devices.add(deviceLabel(session)));
                users.add(new UserSessions(user, sessions.size(), devices));
            }
        });
        return new MultisessionUsers(users);
    }

    public ServerStats serverStats(SessionSnapshot snapshot, List<ActivityEntry> activity, ServerInfo info) {
        Set<String> users = new HashSet<>();
        Set<String> devices = new HashSet<>();
        Map<String, Integer> contentTypes = new TreeMap<>();
        int active = 0;
        for (ClassifiedSession session : snapshot.sessions().values()) {
            if (session.userId() != null || session.userName() != null) {
                users.add(Objects.requireNonNullElse(session.userId(), session.userName()));
            }
            String device = Objects.requireNonNullElse(session.deviceId(), session.deviceName());
            if (device != null) {
                devices.add(device);
            }
            if (session.isActiveStream()) {
                active++;
                if (session.itemType() != null) {
                    contentTypes.merge(session.itemType(), 1, Integer::sum);
                }
            }
        }
        return new ServerStats(snapshot.sessions().size(), active, users.size(), devices.size(), contentTypes,
                activity, info);
    }

    /**
     * Newest activity-log entries, ordered by timestamp only. Entries without a date sort last.
     */
    public static List<ActivityEntry> recentActivity(JsonNode payload) {
        List<ActivityEntry> entries = new ArrayList<>();
        for (JsonNode item : JsonFields.items(payload)) {
            entries.add(new ActivityEntry(
                    JsonFields.instant(item, "Date").orElse(null),
                    JsonFields.text(item, "UserName", "ByUserName", "UserId").orElse(null),
                    JsonFields.text(item, "Name").orElse(null),
                    JsonFields.text(item, "Type").orElse(null)));
        }
        entries.sort(Comparator.comparing(ActivityEntry::date,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return entries.size() > RECENT_ACTIVITY_LIMIT
                ? List.copyOf(entries.subList(0, RECENT_ACTIVITY_LIMIT))
                : List.copyOf(entries);
    }

    static double toMegabytesPerSecond(long bitsPerSecond) {
        return round(bitsPerSecond / 8.0d / BYTES_PER_MEGABYTE, 100.0d);
    }

    static String userLabel(ClassifiedSession session) {
        return session.userName() != null ? session.userName() : UNKNOWN_USER;
    }

    static String deviceLabel(ClassifiedSession session) {
        return Objects.requireNonNullElse(session.deviceName(), Objects.requireNonNullElse(session.deviceId(), "?"));
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}

package org.endlesssource.mediastate.aggregate;

import org.endlesssource.mediastate.api.ActivityEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param contentTypes Active streams per item type
 * @param recentActivity Newest activity-log entries first
 */
public record ServerStats(int totalSessions,
                          int activeSessions,
                          int uniqueUsers,
                          int uniqueDevices,
                          Map<String, Integer> contentTypes,
                          List<ActivityEntry> recentActivity,
                          ServerInfo serverInfo) {
    public ServerStats {
        contentTypes = Collections.unmodifiableMap(new LinkedHashMap<>(contentTypes));
        recentActivity = List.copyOf(recentActivity);
        serverInfo = serverInfo == null ? ServerInfo.UNKNOWN : serverInfo;
    }
}

package org.endlesssource.mediastate.aggregate;

import java.util.List;

/**
 * @param count Sessions with media that report playback progress
 * @param totalSessions All sessions in the poll
 * @param users Distinct users of the active streams, sorted
 */
public record ActiveStreams(int count, int totalSessions, List<String> users) {
    public ActiveStreams {
        users = List.copyOf(users);
    }
}

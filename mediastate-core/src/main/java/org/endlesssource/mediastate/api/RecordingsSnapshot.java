package org.endlesssource.mediastate.api;

import java.util.List;

public record RecordingsSnapshot(List<Recording> active, List<Recording> scheduled, List<Recording> series) {
    public static final RecordingsSnapshot EMPTY = new RecordingsSnapshot(List.of(), List.of(), List.of());

    public RecordingsSnapshot {
        active = List.copyOf(active);
        scheduled = List.copyOf(scheduled);
        series = List.copyOf(series);
    }

    public int total() {
        return active.size() + scheduled.size() + series.size();
    }
}

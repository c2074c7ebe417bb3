package org.endlesssource.mediastate.api;

import java.util.List;

/**
 * Recurrence rule of a series timer.
 */
public record SeriesRule(boolean recordAnyTime, boolean recordAnyChannel, List<String> days) {
    public SeriesRule {
        days = days == null ? List.of() : List.copyOf(days);
    }
}

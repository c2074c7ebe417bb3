package org.endlesssource.mediastate.api;

import java.time.Instant;

/**
 * Server activity-log entry.
 */
public record ActivityEntry(Instant date, String user, String name, String type) {
}

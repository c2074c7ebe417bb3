package org.endlesssource.mediastate.aggregate;

import java.util.Set;

/**
 * A user with more than one concurrent active stream.
 */
public record UserSessions(String user, int count, Set<String> devices) {
    public UserSessions {
        devices = Set.copyOf(devices);
    }
}

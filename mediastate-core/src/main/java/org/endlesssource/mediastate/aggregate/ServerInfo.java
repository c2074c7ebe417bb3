package org.endlesssource.mediastate.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.raw.JsonFields;

/**
 * Version and platform reported by the server.
 */
public record ServerInfo(String serverName, String version, String operatingSystem, String architecture) {
    public static final ServerInfo UNKNOWN = new ServerInfo(null, null, null, null);

    public static ServerInfo from(JsonNode payload) {
        return new ServerInfo(
                JsonFields.text(payload, "ServerName").orElse(null),
                JsonFields.text(payload, "Version").orElse(null),
                JsonFields.text(payload, "OperatingSystemDisplayName", "OperatingSystem").orElse(null),
                JsonFields.text(payload, "SystemArchitecture").orElse(null));
    }
}

package org.endlesssource.mediastate;

import java.util.Objects;

/**
 * Availability information for a media server provider.
 */
public record ProviderSupport(String serverType, boolean available, String reason) {
    public ProviderSupport(String serverType, boolean available, String reason) {
        this.serverType = Objects.requireNonNull(serverType, "serverType must not be null");
        this.available = available;
        this.reason = reason == null ? "" : reason;
    }

    public static ProviderSupport available(String serverType) {
        return new ProviderSupport(serverType, true, "");
    }

    public static ProviderSupport unavailable(String serverType, String reason) {
        return new ProviderSupport(serverType, false, reason);
    }
}

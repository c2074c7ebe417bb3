package org.endlesssource.mediastate.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a category's polling health.
 */
public record CategoryStatus(Category category,
                             CategoryHealth health,
                             Instant lastSuccess,
                             int consecutiveFailures,
                             String lastError) {

    public CategoryStatus {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(health, "health must not be null");
    }

    public static CategoryStatus initial(Category category) {
        return new CategoryStatus(category, CategoryHealth.OK, null, 0, null);
    }

    public Optional<Instant> getLastSuccess() {
        return Optional.ofNullable(lastSuccess);
    }
}

package org.endlesssource.mediastate.poll;

import org.endlesssource.mediastate.api.Category;
import org.endlesssource.mediastate.api.CategoryHealth;
import org.endlesssource.mediastate.api.CategoryStatus;

import java.time.Instant;

/**
 * Health bookkeeping for one category, written by its own poll loop.
 */
final class CategoryState {
    private final Category category;
    private CategoryHealth health = CategoryHealth.OK;
    private Instant lastSuccess;
    private int consecutiveFailures;
    private String lastError;

    CategoryState(Category category) {
        this.category = category;
    }

    synchronized void recordSuccess(Instant at) {
        health = CategoryHealth.OK;
        lastSuccess = at;
        consecutiveFailures = 0;
        lastError = null;
    }

    /**
     * @return true when this failure crossed the threshold
     */
    synchronized boolean recordFailure(String error, int threshold) {
        consecutiveFailures++;
        lastError = error;
        if (consecutiveFailures >= threshold) {
            boolean crossed = health != CategoryHealth.UNAVAILABLE;
            health = CategoryHealth.UNAVAILABLE;
            return crossed;
        }
        health = CategoryHealth.STALE;
        return false;
    }

    synchronized void recordConfigError(String error) {
        consecutiveFailures++;
        lastError = error;
        health = CategoryHealth.CONFIG_ERROR;
    }

    synchronized void disable() {
        health = CategoryHealth.DISABLED;
        consecutiveFailures = 0;
        lastError = null;
    }

    synchronized void reset() {
        health = CategoryHealth.OK;
        consecutiveFailures = 0;
        lastError = null;
    }

    synchronized CategoryHealth health() {
        return health;
    }

    synchronized Instant lastSuccess() {
        return lastSuccess;
    }

    synchronized CategoryStatus snapshot() {
        return new CategoryStatus(category, health, lastSuccess, consecutiveFailures, lastError);
    }
}

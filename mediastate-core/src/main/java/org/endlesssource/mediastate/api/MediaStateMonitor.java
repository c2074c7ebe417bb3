package org.endlesssource.mediastate.api;

import java.util.Map;
import java.util.Optional;

/**
 * Running monitor for one media server.
 * Polls each category on its own schedule and pushes derived state to a {@link Publisher}.
 */
public interface MediaStateMonitor extends AutoCloseable {

    /**
     * Start polling. Calling twice has no effect.
     */
    void start();

    /**
     * Latest session snapshot
     * @return The snapshot of the last successful session poll, empty before the first one
     */
    SessionSnapshot getSessions();

    /**
     * Find a session by its entity key
     * @param key Entity key
     * @return Optional containing the session if it was present in the last poll
     */
    Optional<ClassifiedSession> getSession(String key);

    /**
     * Playback controls addressed by session entity key
     */
    SessionControls getControls();

    /**
     * Polling health of every category
     */
    Map<Category, CategoryStatus> getCategoryStatus();

    /**
     * Replace the options. Categories that became inactive stop and tear down their entities.
     * @param options New options
     */
    void updateOptions(MonitorOptions options);

    MonitorOptions getOptions();

    /**
     * Restart a category halted by an authorization failure
     * @param category The category to resume
     */
    void resume(Category category);

    /**
     * Stop polling and release resources.
     */
    @Override
    void close();
}

package org.endlesssource.mediastate.poll;

import org.endlesssource.mediastate.api.TransportException;

/**
 * Receives the result of each poll on the category's scheduler thread.
 */
public interface PollOutcome<T> {

    /**
     * Commit a completed poll. Only called for polls that finished within the timeout.
     */
    void onSuccess(T result);

    /**
     * The poll failed, timed out or was rejected. After an unauthorized failure the
     * category is no longer scheduled.
     */
    void onFailure(TransportException failure);
}

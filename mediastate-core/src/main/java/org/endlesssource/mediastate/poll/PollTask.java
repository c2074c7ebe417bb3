package org.endlesssource.mediastate.poll;

import org.endlesssource.mediastate.api.TransportException;

/**
 * Fetching half of a category poll. Runs on a worker thread and may be abandoned on timeout,
 * so it must not publish anything itself.
 */
@FunctionalInterface
public interface PollTask<T> {
    T poll() throws TransportException;
}

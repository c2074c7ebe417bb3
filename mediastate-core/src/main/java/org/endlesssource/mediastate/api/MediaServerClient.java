package org.endlesssource.mediastate.api;

/**
 * Everything the monitor needs from one media server connection.
 */
public interface MediaServerClient extends Fetcher, CommandTransport, ImageUrls, AutoCloseable {

    /**
     * Release the underlying connection resources.
     */
    @Override
    void close();
}

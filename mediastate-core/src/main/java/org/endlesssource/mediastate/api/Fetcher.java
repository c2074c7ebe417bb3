package org.endlesssource.mediastate.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Reads one decoded payload from the media server.
 */
public interface Fetcher {

    /**
     * Fetch an endpoint
     * @param endpoint The logical endpoint
     * @param params Endpoint parameters, see the {@code PARAM_*} constants on {@link Endpoint}
     * @return The decoded payload, never null
     * @throws TransportException if the server could not be reached or answered badly
     */
    JsonNode fetch(Endpoint endpoint, Map<String, String> params) throws TransportException;

    default JsonNode fetch(Endpoint endpoint) throws TransportException {
        return fetch(endpoint, Map.of());
    }
}

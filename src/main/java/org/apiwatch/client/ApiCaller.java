package org.apiwatch.client;

/**
 * Outbound HTTP capability used for trial calls and scheduled polls.
 */
public interface ApiCaller {

    /**
     * Returns status, body and latency for any HTTP response, whatever its status code.
     *
     * @throws UpstreamCallException when no response was received
     */
    ApiResponse call(ApiRequest request) throws UpstreamCallException;
}

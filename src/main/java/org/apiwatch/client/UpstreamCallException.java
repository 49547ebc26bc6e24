package org.apiwatch.client;

/**
 * No HTTP response was received: connection refused, DNS failure, timeout, malformed URL.
 */
public class UpstreamCallException extends Exception {

    private final long latencyMillis;

    public UpstreamCallException(String message, long latencyMillis, Throwable cause) {
        super(message, cause);
        this.latencyMillis = latencyMillis;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }
}

package org.apiwatch.monitoring;

/**
 * The trial call got no response at all.
 */
public class UpstreamUnreachableException extends MonitoringException {

    public UpstreamUnreachableException(String message) {
        super(502, message);
    }

    public UpstreamUnreachableException(String message, Throwable cause) {
        super(502, message, cause);
    }
}

package org.apiwatch.monitoring;

/**
 * The trial call got a non-2xx response.
 */
public class UpstreamRejectedException extends MonitoringException {

    private final int upstreamStatus;

    public UpstreamRejectedException(int upstreamStatus, String message) {
        super(422, message);
        this.upstreamStatus = upstreamStatus;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }
}

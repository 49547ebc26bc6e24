package org.apiwatch.monitoring;

/**
 * Base of the errors returned to tenants. Each carries the HTTP status the REST layer answers with.
 */
public abstract class MonitoringException extends RuntimeException {

    private final int statusCode;

    protected MonitoringException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    protected MonitoringException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

package org.apiwatch.monitoring;

/**
 * The tenant key does not own the configuration.
 */
public class ForbiddenException extends MonitoringException {

    public ForbiddenException(String message) {
        super(403, message);
    }
}

package org.apiwatch.monitoring;

/**
 * Configuration was rejected before any call was made.
 */
public class InvalidConfigurationException extends MonitoringException {

    public InvalidConfigurationException(String message) {
        super(400, message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(400, message, cause);
    }
}

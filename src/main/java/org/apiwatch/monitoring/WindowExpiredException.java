package org.apiwatch.monitoring;

/**
 * The configuration's stop time has already passed.
 */
public class WindowExpiredException extends MonitoringException {

    public WindowExpiredException(String message) {
        super(409, message);
    }
}

package org.apiwatch.monitoring;

public class NotFoundException extends MonitoringException {

    public NotFoundException(String message) {
        super(404, message);
    }
}

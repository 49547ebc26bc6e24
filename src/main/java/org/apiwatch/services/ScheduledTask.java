package org.apiwatch.services;

public interface ScheduledTask {
    /**
     * A short name used for logging and the background_tasks row.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Exceptions are logged by the scheduler and recorded as a failed run.
     */
    void execute();
}

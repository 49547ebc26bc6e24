package org.apiwatch.services.tasks;

import org.apiwatch.config.utils.LogContext;
import org.apiwatch.monitoring.RetentionSweeper;
import org.apiwatch.services.ScheduledTask;

import java.time.Duration;

/**
 * Removes configurations idle past the retention window, daily by default.
 */
public class RetentionSweepTask implements ScheduledTask {

    private final RetentionSweeper sweeper;
    private final long intervalSeconds;

    public RetentionSweepTask(RetentionSweeper sweeper, Duration sweepInterval) {
        this.sweeper = sweeper;
        this.intervalSeconds = Math.max(1, sweepInterval.toSeconds());
    }

    @Override public String name() { return "RetentionSweepTask"; }
    @Override public long intervalSeconds() { return intervalSeconds; }

    @Override
    public void execute() {
        LogContext.start("RetentionSweep");
        try {
            sweeper.sweep();
        } finally {
            LogContext.clear();
        }
    }
}

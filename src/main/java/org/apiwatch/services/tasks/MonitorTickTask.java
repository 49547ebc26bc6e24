package org.apiwatch.services.tasks;

import org.apiwatch.config.utils.LogContext;
import org.apiwatch.monitoring.MonitoringScheduler;
import org.apiwatch.monitoring.TickReport;
import org.apiwatch.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Drives {@link MonitoringScheduler#tick()}.
 */
public class MonitorTickTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(MonitorTickTask.class);

    private final MonitoringScheduler scheduler;
    private final long intervalSeconds;

    public MonitorTickTask(MonitoringScheduler scheduler, Duration tickInterval) {
        this.scheduler = scheduler;
        this.intervalSeconds = Math.max(1, tickInterval.toSeconds());
    }

    @Override public String name() { return "MonitorTickTask"; }
    @Override public long intervalSeconds() { return intervalSeconds; }

    @Override
    public void execute() {
        LogContext.start("MonitorTick");
        try {
            TickReport report = scheduler.tick();
            if (report.executed() > 0 || report.errors() > 0) {
                logger.info("Tick: due={} executed={} retired={} conflicts={} errors={}",
                        report.due(), report.executed(), report.retired(), report.conflicts(), report.errors());
            }
        } finally {
            LogContext.clear();
        }
    }
}

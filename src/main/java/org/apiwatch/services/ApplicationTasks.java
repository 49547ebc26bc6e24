package org.apiwatch.services;

import org.apiwatch.services.tasks.MonitorTickTask;
import org.apiwatch.services.tasks.RetentionSweepTask;
import org.apiwatch.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ApplicationTasks {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationTasks.class);

    private ApplicationTasks() {}

    /**
     * Rebuilds the active job set from the store, then schedules the tick and the retention sweep.
     * Needs a reachable database; call again once it comes back.
     */
    public static void registerApplicationTasks(TaskScheduler appScheduler, ServiceRegistry registry) {
        logger.info("[------------ Registering Services ------------]");

        try {
            registry.scheduler().rebuild();
        } catch (StoreException e) {
            logger.error("Failed to rebuild active jobs, relying on periodic resync", e);
        }

        appScheduler.register(new MonitorTickTask(registry.scheduler(), registry.settings().tickInterval()));
        appScheduler.register(new RetentionSweepTask(registry.sweeper(), registry.settings().retentionSweepInterval()));
        appScheduler.start();
        logger.info("Idle configurations are purged after {} days", registry.sweeper().retention().toDays());

        logger.info("[------------ Application tasks registered: {} ------------]", appScheduler.taskNames());
    }
}

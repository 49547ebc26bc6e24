package org.apiwatch.config.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single daemon thread that retries the database connection while the service runs degraded.
 */
public class DBTaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DBTaskScheduler.class);
    private static final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "db-reconnect");
        t.setDaemon(true);
        return t;
    });

    private DBTaskScheduler() {}

    /**
     * First attempt after one period, then every period until the returned future is cancelled.
     */
    public static ScheduledFuture<?> scheduleReconnect(Runnable task, Duration every) {
        long millis = every.toMillis();
        logger.info("Retrying database connection every {}s", every.toSeconds());
        return executor.scheduleWithFixedDelay(task, millis, millis, TimeUnit.MILLISECONDS);
    }

    public static void shutdown() {
        executor.shutdownNow();
        logger.info("DB reconnect scheduler stopped.");
    }
}

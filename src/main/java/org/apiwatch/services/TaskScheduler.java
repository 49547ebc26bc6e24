package org.apiwatch.services;

import org.apiwatch.utils.DbUtil;
import org.apiwatch.utils.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-rate runner for {@link ScheduledTask}s. Every run is recorded in background_tasks when a
 * connection provider is given.
 */
public class TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final DbUtil.ConnectionProvider taskLog;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<ScheduledTask> tasks = new ArrayList<>();

    public TaskScheduler(int poolSize) {
        this(poolSize, JdbcUtils::getConnection);
    }

    /**
     * @param taskLog where runs are recorded; null disables recording
     */
    public TaskScheduler(int poolSize, DbUtil.ConnectionProvider taskLog) {
        this.executor = new ScheduledThreadPoolExecutor(poolSize, namedThreads("task-scheduler"));
        this.executor.setRemoveOnCancelPolicy(true);
        this.taskLog = taskLog;
    }

    public synchronized void register(ScheduledTask task) {
        tasks.add(task);
    }

    /**
     * Starts every registered task that is not running yet.
     */
    public synchronized void start() {
        for (int i = futures.size(); i < tasks.size(); i++) {
            ScheduledTask t = tasks.get(i);
            logger.info("Scheduling task {} every {}s", t.name(), t.intervalSeconds());
            futures.add(executor.scheduleAtFixedRate(() -> runTaskWithLogging(t),
                    0, t.intervalSeconds(), TimeUnit.SECONDS));
        }
    }

    public synchronized List<String> taskNames() {
        return tasks.stream().map(ScheduledTask::name).toList();
    }

    private void runTaskWithLogging(ScheduledTask task) {
        Instant start = Instant.now();
        String errorMessage = null;
        try {
            task.execute();
        } catch (Exception e) {
            errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            logger.error("Error in scheduled task {}: {}", task.name(), errorMessage, e);
        } finally {
            logBackgroundTask(task, start, errorMessage);
        }
    }

    private void logBackgroundTask(ScheduledTask task, Instant start, String errorMessage) {
        if (taskLog == null) return;
        String sql = """
                INSERT INTO background_tasks(task_name, task_type, status, last_run_at, next_run_at, error_message,
                                             date_created, date_modified)
                VALUES (?, ?, ?, ?, ?, ?, now(), now())
                ON CONFLICT (task_name) DO UPDATE SET status = EXCLUDED.status,
                    last_run_at = EXCLUDED.last_run_at, next_run_at = EXCLUDED.next_run_at,
                    error_message = EXCLUDED.error_message, date_modified = now()
                """;
        try {
            DbUtil.update(taskLog, sql, ps -> {
                ps.setString(1, task.name());
                ps.setString(2, "SCHEDULED");
                ps.setString(3, errorMessage == null ? "SUCCESS" : "FAILED");
                JdbcUtils.setInstant(ps, 4, start);
                JdbcUtils.setInstant(ps, 5, start.plusSeconds(task.intervalSeconds()));
                ps.setString(6, errorMessage);
            });
        } catch (SQLException e) {
            logger.warn("[TaskLogger] Failed to log task {}: {}", task.name(), e.getMessage());
        }
    }

    public void stop() {
        logger.info("Shutting down TaskScheduler...");
        synchronized (this) {
            for (ScheduledFuture<?> f : futures) f.cancel(false);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("TaskScheduler did not terminate gracefully");
                executor.shutdownNow();
            } else {
                logger.info("TaskScheduler stopped.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }

    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

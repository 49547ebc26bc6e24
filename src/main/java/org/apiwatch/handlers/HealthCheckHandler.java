package org.apiwatch.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.apiwatch.config.database.DatabaseManager;
import org.apiwatch.config.utils.EnvProvider;
import org.apiwatch.monitoring.MonitoringScheduler;
import org.apiwatch.utils.DbUtil;
import org.apiwatch.utils.JdbcUtils;
import org.apiwatch.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  database status,
 *          -  background task statuses,
 *          -  number of active monitoring jobs.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckHandler.class);
    private static final Instant START_TIME = Instant.now();

    private final MonitoringScheduler scheduler;

    public HealthCheckHandler(MonitoringScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "apiwatch REST API");
        response.put("version", "1.0.0");
        response.put("environment", EnvProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());

        boolean dbOK = false;
        if (DatabaseManager.isInitialized()) {
            try (Connection conn = JdbcUtils.getConnection()) {
                dbOK = conn.isValid(2);
            } catch (SQLException e) {
                logger.warn("Database health probe failed: {}", e.getMessage());
            }
        }
        response.put("database", "PostgreSQL");
        response.put("database_status", dbOK ? "connected" : "unavailable");

        List<Map<String, Object>> tasks = List.of();
        if (dbOK) {
            try {
                tasks = DbUtil.queryList(JdbcUtils::getConnection, """
                        SELECT task_name, task_type, status, last_run_at, next_run_at, error_message
                        FROM background_tasks ORDER BY task_name
                        """, ps -> {}, rs -> {
                    Map<String, Object> task = new LinkedHashMap<>();
                    task.put("name", rs.getString("task_name"));
                    task.put("type", rs.getString("task_type"));
                    task.put("status", rs.getString("status"));
                    task.put("last_run_at", JdbcUtils.getInstant(rs, "last_run_at"));
                    task.put("next_run_at", JdbcUtils.getInstant(rs, "next_run_at"));
                    task.put("error_message", rs.getString("error_message"));
                    return task;
                });
            } catch (SQLException e) {
                response.put("tasks_error", "Failed to query background tasks: " + e.getMessage());
            }
        }
        response.put("background_tasks", tasks);
        response.put("active_jobs", scheduler.activeJobCount());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}

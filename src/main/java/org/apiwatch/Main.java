package org.apiwatch;

import io.undertow.Undertow;
import org.apiwatch.client.JdkApiCaller;
import org.apiwatch.config.ConfigLoader;
import org.apiwatch.config.XmlConfiguration;
import org.apiwatch.config.database.DBTaskScheduler;
import org.apiwatch.config.database.DatabaseManager;
import org.apiwatch.config.utils.EnvProvider;
import org.apiwatch.config.utils.LogContext;
import org.apiwatch.monitoring.MonitoringSettings;
import org.apiwatch.rest.RestApiServer;
import org.apiwatch.services.ServiceRegistry;
import org.apiwatch.services.TaskScheduler;
import org.apiwatch.store.JdbcConfigurationStore;
import org.apiwatch.store.JdbcResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.apiwatch.services.ApplicationTasks.registerApplicationTasks;

/**
 * Entry point
 * Load Configuration from Xml
 * Connect to Database
 * Start the REST API and the monitoring tasks
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final TaskScheduler appScheduler = new TaskScheduler(2);

    public static void main(String[] args) {
        EnvProvider.init();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting apiwatch ------------]");

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            MonitoringSettings settings = MonitoringSettings.from(cfg.monitoring);
            ServiceRegistry registry = ServiceRegistry.create(settings,
                    new JdbcConfigurationStore(), new JdbcResultStore(),
                    new JdkApiCaller(settings.callTimeout()), Clock.systemUTC());

            boolean dbAvailable = false;
            try {
                DatabaseManager.initialize(cfg);
                dbAvailable = true;
            } catch (SQLException e) {
                logger.error("Database initialization failed: {}", e.getMessage());
                logger.warn("[------------ Continuing in DEGRADED MODE, database unavailable ------------]");
            }

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.startUndertow(cfg, registry);

            AtomicBoolean tasksRegistered = new AtomicBoolean(false);
            if (dbAvailable) {
                tasksRegistered.set(true);
                registerApplicationTasks(appScheduler, registry);
            } else {
                logger.info("[------------ Starting background DB reconnection monitor ------------]");
                AtomicReference<ScheduledFuture<?>> monitor = new AtomicReference<>();
                monitor.set(DBTaskScheduler.scheduleReconnect(() -> {
                    LogContext.start("DBReconnect");
                    try {
                        DatabaseManager.initialize(cfg);
                        logger.info("[------------ Database reconnected successfully ------------]");
                        if (tasksRegistered.compareAndSet(false, true)) {
                            registerApplicationTasks(appScheduler, registry);
                        }
                        ScheduledFuture<?> self = monitor.get();
                        if (self != null) self.cancel(false);
                    } catch (SQLException e) {
                        logger.warn("Database still unavailable: {}", e.getMessage());
                    } finally {
                        LogContext.clear();
                    }
                }, reconnectInterval(cfg)));
            }

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                server.stop();
                appScheduler.stop();
                registry.scheduler().shutdown();
                DBTaskScheduler.shutdown();
                DatabaseManager.shutdown();
                logger.info("[------------ apiwatch shutdown complete ------------]");
            }));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }

    private static Duration reconnectInterval(XmlConfiguration cfg) {
        int seconds = cfg.dataSource != null ? cfg.dataSource.reconnectIntervalSeconds : 0;
        return Duration.ofSeconds(seconds > 0 ? seconds : 20);
    }
}

package org.apiwatch.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apiwatch.config.XmlConfiguration;
import org.apiwatch.config.utils.LogContext;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the HikariCP pool behind {@link org.apiwatch.utils.JdbcUtils#getConnection()}.
 * A failed {@link #initialize} leaves the service in degraded mode until a later attempt succeeds;
 * the monitoring tables are created on the first successful attempt when {@code initializeSchema} is set.
 */
public class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private static volatile HikariDataSource dataSource;
    private static volatile boolean initialized = false;

    private DatabaseManager() {}

    public static boolean isInitialized() {
        return initialized;
    }

    public static synchronized void initialize(XmlConfiguration cfg) throws SQLException {
        LogContext.start("DatabaseManager");
        try {
            if (cfg == null || cfg.dataSource == null || cfg.connectionPool == null) {
                throw new SQLException("Invalid configuration: missing dataSource or connectionPool section.");
            }
            logger.info("Initializing database connection...");
            HikariConfig hc = getHikariConfig(cfg);

            if (cfg.dataSource.encrypt) {
                hc.addDataSourceProperty("ssl", "true");
                hc.addDataSourceProperty("sslmode", "require");
                logger.info("SSL enabled for PostgreSQL connection");
            } else {
                hc.addDataSourceProperty("ssl", "false");
                logger.info("SSL disabled for PostgreSQL connection");
            }

            HikariDataSource newDs = new HikariDataSource(hc);
            try {
                prepare(newDs, cfg.dataSource.initializeSchema);
            } catch (SQLException e) {
                newDs.close();
                throw e;
            }

            HikariDataSource previous = dataSource;
            dataSource = newDs;
            initialized = true;
            if (previous != null) {
                previous.close();
            }
            logger.info("Database connection successful: {} (pool {}..{})", cfg.dataSource.jdbcUrl,
                    cfg.connectionPool.minimumIdle, cfg.connectionPool.maximumPoolSize);

        } catch (SQLException e) {
            initialized = false;
            logger.error("Database initialization failed: {}", e.getMessage());
            throw e;
        } finally {
            LogContext.clear();
        }
    }

    private static void prepare(HikariDataSource ds, boolean initializeSchema) throws SQLException {
        logger.debug("Testing initial database connection...");
        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(2)) {
                throw new SQLException("Connection failed: connection is invalid.");
            }
        }
        if (initializeSchema) {
            SchemaInitializer.apply(ds);
        }
    }

    @NotNull
    private static HikariConfig getHikariConfig(XmlConfiguration cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("apiwatch-pool");
        hc.setJdbcUrl(cfg.dataSource.jdbcUrl);
        hc.setUsername(cfg.dataSource.username);
        hc.setPassword(cfg.dataSource.password);
        hc.setDriverClassName(
                cfg.dataSource.driverClassName != null
                        ? cfg.dataSource.driverClassName
                        : "org.postgresql.Driver"
        );
        hc.setMaximumPoolSize(cfg.connectionPool.maximumPoolSize);
        hc.setMinimumIdle(cfg.connectionPool.minimumIdle);
        hc.setIdleTimeout(cfg.connectionPool.idleTimeout);
        hc.setConnectionTimeout(cfg.connectionPool.connectionTimeout);
        hc.setMaxLifetime(cfg.connectionPool.maxLifetime);
        // First connect happens in initialize(); a dead database must not block pool construction.
        hc.setInitializationFailTimeout(-1);
        return hc;
    }

    public static HikariDataSource getDataSource() {
        return initialized ? dataSource : null;
    }

    /**
     * Shutdown the connection pool safely.
     */
    public static synchronized void shutdown() {
        initialized = false;
        if (dataSource != null) {
            try {
                dataSource.close();
                logger.info("Database connection pool shutdown successfully.");
            } catch (Exception e) {
                logger.warn("Error shutting down connection pool: {}", e.getMessage());
            }
        }
    }
}

package org.apiwatch.config;

import jakarta.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public DataSource dataSource;
    public ConnectionPool connectionPool;
    public Logging logging;
    public Monitoring monitoring;

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host;
        public int port;
        public int ioThreads;
        public int workerThreads;
        public String basePath;
        public String allowedOrigins;
    }

    // --- Data Source ---
    @XmlRootElement(name = "dataSource")
    public static class DataSource {
        public String driverClassName;
        public String jdbcUrl;
        public String username;
        public String password;
        public boolean encrypt;
        public boolean initializeSchema;
        public int reconnectIntervalSeconds;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize;
        public int minimumIdle;
        public long idleTimeout;
        public long connectionTimeout;
        public long maxLifetime;
    }

    // --- Logging ---
    @XmlRootElement(name = "logging")
    public static class Logging {
        public String level;
        public String logFile;
    }

    // --- Scheduler, validation bounds, retention ---
    @XmlRootElement(name = "monitoring")
    public static class Monitoring {
        public int tickIntervalSeconds;
        public int callTimeoutSeconds;
        public int workerThreads;
        public int resyncEveryTicks;
        public double minIntervalMinutes;
        public double maxIntervalMinutes;
        public int defaultWindowHours;
        public int maxWindowHours;
        public int summaryResultLimit;
        public int excerptLength;
        public int retentionDays;
        public int retentionSweepIntervalHours;
        public boolean recordTrialResult;
    }
}

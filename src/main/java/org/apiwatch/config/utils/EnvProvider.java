package org.apiwatch.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EnvProvider = central environment and secret lookup.
 * Responsibilities:
 *   1. Load environment (.env + system ENV)
 *   2. Initialize correct Logback (dev/prod)
 *   3. Provide data source overrides (DB_URL, DB_USER, DB_PASSWORD)
 * Priority for resolution:
 *     1. System environment variable
 *     2. .env file
 */
public class EnvProvider {

    private static final Logger logger = LoggerFactory.getLogger(EnvProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";

    private static volatile boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;
    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private EnvProvider() {}

    public static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure()
                    .ignoreIfMalformed()
                    .ignoreIfMissing()
                    .load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            if ("DEVELOPMENT".equals(activeEnv)) {
                loadLogback("logback-dev.xml");
            } else {
                loadLogback("logback.xml");
            }

            initialized = true;
            logger.info("EnvProvider initialized, environment: {}", activeEnv);

        } catch (Exception e) {
            System.err.println("EnvProvider initialization failed: " + e.getMessage());
            throw new IllegalStateException("Failed initializing environment", e);
        }
    }

    /**
     * Optional lookup; blank values count as missing.
     */
    public static Optional<String> find(String keyName) {
        if (!initialized) init();

        String cached = CACHE.get(keyName);
        if (cached != null) return Optional.of(cached);

        String value = System.getenv(keyName);
        if ((value == null || value.isBlank()) && dotenv != null) {
            value = dotenv.get(keyName);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        CACHE.put(keyName, value.trim());
        logger.debug("Value '{}' loaded ({} chars)", keyName, value.length());
        return Optional.of(value.trim());
    }

    public static String getEnvironment() { return activeEnv; }

    /** Load logback safely */
    private static void loadLogback(String fileName) {
        try (InputStream in = EnvProvider.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                System.err.println("Logback file not found on classpath: " + fileName);
                return;
            }
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            ctx.reset();

            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(ctx);
            configurator.doConfigure(in);

            StatusPrinter.printInCaseOfErrorsOrWarnings(ctx);
        } catch (Exception e) {
            System.err.println("ERROR loading logback: " + fileName + ": " + e.getMessage());
        }
    }
}

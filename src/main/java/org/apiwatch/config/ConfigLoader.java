package org.apiwatch.config;

import org.apiwatch.config.utils.EnvProvider;
import org.apiwatch.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Loads the XML configuration from the filesystem, falling back to the classpath,
     * then applies data source overrides from the environment.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try {
            XmlConfiguration cfg;
            Path path = Path.of(xmlPath);
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    cfg = XmlUtil.unmarshal(in, XmlConfiguration.class);
                }
                logger.debug("Configuration read from file {}", path.toAbsolutePath());
            } else {
                try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(xmlPath)) {
                    if (in == null) {
                        throw new IllegalStateException("No configuration at " + xmlPath + " (file or classpath)");
                    }
                    cfg = XmlUtil.unmarshal(in, XmlConfiguration.class);
                }
                logger.debug("Configuration read from classpath {}", xmlPath);
            }
            applyEnvironmentOverrides(cfg);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    private static void applyEnvironmentOverrides(XmlConfiguration cfg) {
        if (cfg.dataSource == null) return;
        EnvProvider.find("DB_URL").ifPresent(v -> cfg.dataSource.jdbcUrl = v);
        EnvProvider.find("DB_USER").ifPresent(v -> cfg.dataSource.username = v);
        EnvProvider.find("DB_PASSWORD").ifPresent(v -> cfg.dataSource.password = v);
    }
}

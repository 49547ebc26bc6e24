package org.apiwatch.monitoring;

import org.apiwatch.store.ConfigurationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes configurations with no activity inside the retention window. Results go with them by cascade.
 */
public class RetentionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(RetentionSweeper.class);

    private final ConfigurationStore configurations;
    private final Duration retention;
    private final Clock clock;

    public RetentionSweeper(ConfigurationStore configurations, Duration retention, Clock clock) {
        this.configurations = configurations;
        this.retention = retention;
        this.clock = clock;
    }

    public int sweep() {
        return sweep(clock.instant());
    }

    public int sweep(Instant now) {
        Instant cutoff = now.minus(retention);
        int deleted = configurations.deleteIdleSince(cutoff);
        if (deleted > 0) {
            logger.info("Retention sweep removed {} configurations idle since before {}", deleted, cutoff);
        } else {
            logger.debug("Retention sweep found nothing idle since before {}", cutoff);
        }
        return deleted;
    }

    public Duration retention() {
        return retention;
    }
}

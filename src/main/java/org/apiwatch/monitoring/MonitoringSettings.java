package org.apiwatch.monitoring;

import org.apiwatch.config.XmlConfiguration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Resolved {@code <monitoring>} section. Zero or missing values fall back to defaults.
 */
public record MonitoringSettings(
        Duration tickInterval,
        Duration callTimeout,
        int workerThreads,
        int resyncEveryTicks,
        BigDecimal minIntervalMinutes,
        BigDecimal maxIntervalMinutes,
        int defaultWindowHours,
        int maxWindowHours,
        int summaryResultLimit,
        int excerptLength,
        Duration retention,
        Duration retentionSweepInterval,
        boolean recordTrialResult
) {

    public static MonitoringSettings defaults() {
        return new MonitoringSettings(
                Duration.ofSeconds(30),
                Duration.ofSeconds(30),
                16,
                10,
                BigDecimal.ONE,
                BigDecimal.valueOf(1440),
                24,
                168,
                10,
                200,
                Duration.ofDays(14),
                Duration.ofHours(24),
                false);
    }

    public static MonitoringSettings from(XmlConfiguration.Monitoring m) {
        MonitoringSettings d = defaults();
        if (m == null) return d;
        return new MonitoringSettings(
                m.tickIntervalSeconds > 0 ? Duration.ofSeconds(m.tickIntervalSeconds) : d.tickInterval(),
                m.callTimeoutSeconds > 0 ? Duration.ofSeconds(m.callTimeoutSeconds) : d.callTimeout(),
                m.workerThreads > 0 ? m.workerThreads : d.workerThreads(),
                m.resyncEveryTicks > 0 ? m.resyncEveryTicks : d.resyncEveryTicks(),
                m.minIntervalMinutes > 0 ? BigDecimal.valueOf(m.minIntervalMinutes) : d.minIntervalMinutes(),
                m.maxIntervalMinutes > 0 ? BigDecimal.valueOf(m.maxIntervalMinutes) : d.maxIntervalMinutes(),
                m.defaultWindowHours > 0 ? m.defaultWindowHours : d.defaultWindowHours(),
                m.maxWindowHours > 0 ? m.maxWindowHours : d.maxWindowHours(),
                m.summaryResultLimit > 0 ? m.summaryResultLimit : d.summaryResultLimit(),
                m.excerptLength > 0 ? m.excerptLength : d.excerptLength(),
                m.retentionDays > 0 ? Duration.ofDays(m.retentionDays) : d.retention(),
                m.retentionSweepIntervalHours > 0
                        ? Duration.ofHours(m.retentionSweepIntervalHours) : d.retentionSweepInterval(),
                m.recordTrialResult);
    }
}

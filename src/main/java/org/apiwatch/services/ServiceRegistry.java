package org.apiwatch.services;

import org.apiwatch.client.ApiCaller;
import org.apiwatch.monitoring.ConfigIdGenerator;
import org.apiwatch.monitoring.ConfigurationValidator;
import org.apiwatch.monitoring.MonitoringScheduler;
import org.apiwatch.monitoring.MonitoringSettings;
import org.apiwatch.monitoring.RetentionSweeper;
import org.apiwatch.monitoring.RetrievalService;
import org.apiwatch.store.ConfigurationStore;
import org.apiwatch.store.ResultStore;

import java.time.Clock;
import java.util.concurrent.Executors;

/**
 * Wired monitoring components shared by the REST handlers and the background tasks.
 */
public record ServiceRegistry(
        MonitoringSettings settings,
        ConfigurationStore configurations,
        ResultStore results,
        ApiCaller caller,
        ConfigurationValidator validator,
        MonitoringScheduler scheduler,
        RetrievalService retrieval,
        RetentionSweeper sweeper
) {

    public static ServiceRegistry create(MonitoringSettings settings, ConfigurationStore configurations,
                                         ResultStore results, ApiCaller caller, Clock clock) {
        ConfigurationValidator validator = new ConfigurationValidator(configurations, results, caller,
                settings, clock, new ConfigIdGenerator());
        MonitoringScheduler scheduler = new MonitoringScheduler(configurations, results, caller,
                Executors.newFixedThreadPool(settings.workerThreads(), TaskScheduler.namedThreads("monitor-worker")),
                clock, settings.resyncEveryTicks());
        RetrievalService retrieval = new RetrievalService(configurations, results, settings);
        RetentionSweeper sweeper = new RetentionSweeper(configurations, settings.retention(), clock);
        return new ServiceRegistry(settings, configurations, results, caller, validator, scheduler,
                retrieval, sweeper);
    }
}

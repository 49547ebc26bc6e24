package org.apiwatch.handlers.monitors;

import io.undertow.server.HttpServerExchange;
import org.apiwatch.monitoring.ActivationResult;
import org.apiwatch.monitoring.MonitoringScheduler;
import org.apiwatch.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/** POST /monitors/{configId}/activate */
public class ActivateMonitoringHandler extends MonitorHandler {

    private final MonitoringScheduler scheduler;

    public ActivateMonitoringHandler(MonitoringScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    protected void handle(HttpServerExchange exchange, String tenantKey) {
        ActivationResult result = scheduler.activate(configId(exchange), tenantKey);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("config_id", result.configId());
        data.put("is_active", true);
        data.put("next_fire_at", result.nextFireAt());
        data.put("stop_at", result.stopAt());
        data.put("schedule_interval_minutes", result.intervalMinutes());
        ResponseUtil.sendSuccess(exchange,
                result.alreadyActive() ? "Monitoring already active" : "Monitoring activated", data);
    }
}

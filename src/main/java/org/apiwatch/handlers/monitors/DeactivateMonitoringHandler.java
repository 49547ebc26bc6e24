package org.apiwatch.handlers.monitors;

import io.undertow.server.HttpServerExchange;
import org.apiwatch.monitoring.MonitoringScheduler;
import org.apiwatch.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/** POST /monitors/{configId}/deactivate */
public class DeactivateMonitoringHandler extends MonitorHandler {

    private final MonitoringScheduler scheduler;

    public DeactivateMonitoringHandler(MonitoringScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    protected void handle(HttpServerExchange exchange, String tenantKey) {
        long configId = configId(exchange);
        scheduler.deactivate(configId, tenantKey);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("config_id", configId);
        data.put("is_active", false);
        ResponseUtil.sendSuccess(exchange, "Monitoring deactivated", data);
    }
}

package org.apiwatch.handlers.monitors;

import io.undertow.server.HttpServerExchange;
import org.apiwatch.monitoring.RetrievalMode;
import org.apiwatch.monitoring.RetrievalService;
import org.apiwatch.utils.HttpRequestUtil;
import org.apiwatch.utils.ResponseUtil;

/** GET /monitors/{configId}/results?mode=summary|details|full */
public class GetMonitoringResultsHandler extends MonitorHandler {

    private final RetrievalService retrieval;

    public GetMonitoringResultsHandler(RetrievalService retrieval) {
        this.retrieval = retrieval;
    }

    @Override
    protected void handle(HttpServerExchange exchange, String tenantKey) {
        long configId = configId(exchange);
        RetrievalMode mode = RetrievalMode.parse(HttpRequestUtil.getParam(exchange, "mode"));
        ResponseUtil.sendSuccess(exchange, "Results retrieved", retrieval.get(configId, tenantKey, mode));
    }
}

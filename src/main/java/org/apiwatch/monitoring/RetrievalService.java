package org.apiwatch.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import org.apiwatch.client.ApiRequest;
import org.apiwatch.store.ApiConfiguration;
import org.apiwatch.store.CallResult;
import org.apiwatch.store.ConfigurationStore;
import org.apiwatch.store.ResultStats;
import org.apiwatch.store.ResultStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only projections of a configuration and its results.
 * <ul>
 *   <li>summary: metadata, counters and the latest results as short excerpts</li>
 *   <li>details: minimal metadata and every result with full bodies</li>
 *   <li>full: the whole configuration and every result field</li>
 * </ul>
 */
public class RetrievalService {

    private final ConfigurationStore configurations;
    private final ResultStore results;
    private final int summaryResultLimit;
    private final int excerptLength;

    public RetrievalService(ConfigurationStore configurations, ResultStore results, MonitoringSettings settings) {
        this.configurations = configurations;
        this.results = results;
        this.summaryResultLimit = settings.summaryResultLimit();
        this.excerptLength = settings.excerptLength();
    }

    public Map<String, Object> get(long configId, String tenantKey, RetrievalMode mode) {
        ApiConfiguration c = configurations.findByConfigId(configId)
                .orElseThrow(() -> new NotFoundException("Configuration " + configId + " not found"));
        if (!c.ownedBy(tenantKey)) {
            throw new ForbiddenException("API key does not own configuration " + configId);
        }
        RetrievalMode resolved = mode == null ? RetrievalMode.SUMMARY : mode;
        return switch (resolved) {
            case SUMMARY -> summary(c);
            case DETAILS -> details(c);
            case FULL -> full(c);
        };
    }

    private Map<String, Object> summary(ApiConfiguration c) {
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("config_id", c.configId());
        configuration.put("name", c.name());
        configuration.put("description", c.description());
        configuration.put("method", c.method());
        configuration.put("url", ApiRequest.joinUrl(c.baseUrl(), c.endpoint()));
        configuration.put("is_active", c.active());
        configuration.put("schedule_interval_minutes", c.intervalMinutes());
        configuration.put("start_at", c.startAt());
        configuration.put("stop_at", c.stopAt());
        configuration.put("next_fire_at", c.nextFireAt());

        ResultStats stats = results.stats(c.configId());
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("total_calls", stats.total());
        counters.put("successful_calls", stats.successful());
        counters.put("failed_calls", stats.failed());
        counters.put("last_called_at", stats.lastCalledAt());

        List<Map<String, Object>> recent = results.findByConfigId(c.configId(), summaryResultLimit).stream()
                .map(this::excerpt)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", RetrievalMode.SUMMARY.label());
        body.put("configuration", configuration);
        body.put("stats", counters);
        body.put("recent_results", recent);
        return body;
    }

    private Map<String, Object> details(ApiConfiguration c) {
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("config_id", c.configId());
        configuration.put("name", c.name());
        configuration.put("is_active", c.active());

        List<Map<String, Object>> all = results.findByConfigId(c.configId(), 0).stream()
                .map(r -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("called_at", r.calledAt());
                    row.put("is_successful", r.successful());
                    row.put("http_status", r.httpStatus());
                    row.put("response_data", r.responseData());
                    row.put("error_message", r.errorMessage());
                    return row;
                })
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", RetrievalMode.DETAILS.label());
        body.put("configuration", configuration);
        body.put("results", all);
        return body;
    }

    private Map<String, Object> full(ApiConfiguration c) {
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("config_id", c.configId());
        configuration.put("name", c.name());
        configuration.put("description", c.description());
        configuration.put("method", c.method());
        configuration.put("base_url", c.baseUrl());
        configuration.put("endpoint", c.endpoint());
        configuration.put("url", ApiRequest.joinUrl(c.baseUrl(), c.endpoint()));
        configuration.put("params", c.params());
        configuration.put("headers", c.headers());
        configuration.put("additional_params", c.additionalParams());
        configuration.put("is_active", c.active());
        configuration.put("schedule_interval_minutes", c.intervalMinutes());
        configuration.put("start_at", c.startAt());
        configuration.put("stop_at", c.stopAt());
        configuration.put("next_fire_at", c.nextFireAt());
        configuration.put("created_at", c.createdAt());

        List<Map<String, Object>> all = results.findByConfigId(c.configId(), 0).stream()
                .map(r -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", r.id());
                    row.put("config_id", r.configId());
                    row.put("called_at", r.calledAt());
                    row.put("is_successful", r.successful());
                    row.put("http_status", r.httpStatus());
                    row.put("response_time_ms", r.responseTimeMs());
                    row.put("response_data", r.responseData());
                    row.put("error_message", r.errorMessage());
                    return row;
                })
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", RetrievalMode.FULL.label());
        body.put("configuration", configuration);
        body.put("results", all);
        return body;
    }

    private Map<String, Object> excerpt(CallResult r) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("called_at", r.calledAt());
        row.put("is_successful", r.successful());
        row.put("http_status", r.httpStatus());
        row.put("excerpt", truncate(r.successful() ? text(r.responseData()) : r.errorMessage()));
        return row;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= excerptLength) return value;
        return value.substring(0, excerptLength);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.isTextual() ? node.asText() : node.toString();
    }
}

package org.apiwatch.handlers.monitors;

import io.undertow.server.HttpServerExchange;
import org.apiwatch.monitoring.ConfigurationDraft;
import org.apiwatch.monitoring.ConfigurationValidator;
import org.apiwatch.monitoring.InvalidConfigurationException;
import org.apiwatch.monitoring.ValidationOutcome;
import org.apiwatch.utils.HttpRequestUtil;
import org.apiwatch.utils.ResponseUtil;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /monitors/validate
 * <pre>
 * {
 *   "name": "Orders API",
 *   "method": "GET",
 *   "base_url": "https://api.example.com",
 *   "endpoint": "/v1/orders",
 *   "params": {"status": "open"},            or "param_keys_values": "status: open"
 *   "headers": {"Accept": "application/json"}, or "header_keys_values": "Accept: application/json"
 *   "additional_params": {"page": 1},
 *   "schedule_interval_minutes": 5,
 *   "start_at": "2025-01-01T10:00:00Z",
 *   "stop_after_hours": 24                     or "stop_at": "..."
 * }
 * </pre>
 */
public class ValidateConfigurationHandler extends MonitorHandler {

    private final ConfigurationValidator validator;

    public ValidateConfigurationHandler(ConfigurationValidator validator) {
        this.validator = validator;
    }

    @Override
    protected void handle(HttpServerExchange exchange, String tenantKey) {
        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) return;

        ConfigurationDraft draft = ConfigurationDraft.builder()
                .name(HttpRequestUtil.getString(body, "name"))
                .description(HttpRequestUtil.getString(body, "description"))
                .method(HttpRequestUtil.getString(body, "method"))
                .baseUrl(HttpRequestUtil.getString(body, "base_url"))
                .endpoint(HttpRequestUtil.getString(body, "endpoint"))
                .params(firstPresent(body, "params", "param_keys_values"))
                .headers(firstPresent(body, "headers", "header_keys_values"))
                .additionalParams(body.get("additional_params"))
                .intervalMinutes(decimal(body, "schedule_interval_minutes"))
                .startAt(instant(body, "start_at"))
                .stopAt(instant(body, "stop_at"))
                .stopAfterHours(wholeNumber(body, "stop_after_hours"))
                .build();

        ValidationOutcome outcome = validator.validate(tenantKey, draft);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("config_id", outcome.configId());
        data.put("name", outcome.name());
        data.put("is_active", false);
        data.put("http_status", outcome.httpStatus());
        data.put("response_time_ms", outcome.responseTimeMs());
        data.put("sample_response", outcome.sampleResponse());
        data.put("start_at", outcome.startAt());
        data.put("stop_at", outcome.stopAt());
        data.put("schedule_interval_minutes", outcome.intervalMinutes());
        ResponseUtil.sendCreated(exchange, "Configuration validated", data);
    }

    private static Object firstPresent(Map<String, Object> body, String field, String alternative) {
        Object value = body.get(field);
        return value != null ? value : body.get(alternative);
    }

    private static BigDecimal decimal(Map<String, Object> body, String field) {
        try {
            return HttpRequestUtil.getDecimal(body, field);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(field + " must be a number", e);
        }
    }

    private static Integer wholeNumber(Map<String, Object> body, String field) {
        BigDecimal value = decimal(body, field);
        if (value == null) return null;
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidConfigurationException(field + " must be a whole number", e);
        }
    }

    private static Instant instant(Map<String, Object> body, String field) {
        try {
            return HttpRequestUtil.getInstant(body, field);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(field + " must be an ISO-8601 timestamp", e);
        }
    }
}

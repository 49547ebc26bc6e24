package org.apiwatch.monitoring;

import org.apiwatch.client.KeyValueParser;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unvalidated configuration as submitted by a tenant.
 */
public record ConfigurationDraft(
        String name,
        String description,
        String method,
        String baseUrl,
        String endpoint,
        Map<String, Object> params,
        Map<String, Object> headers,
        Map<String, Object> additionalParams,
        BigDecimal intervalMinutes,
        Instant startAt,
        Instant stopAt,
        Integer stopAfterHours
) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private String method = "GET";
        private String baseUrl;
        private String endpoint;
        private Map<String, Object> params = new LinkedHashMap<>();
        private Map<String, Object> headers = new LinkedHashMap<>();
        private Map<String, Object> additionalParams = new LinkedHashMap<>();
        private BigDecimal intervalMinutes;
        private Instant startAt;
        private Instant stopAt;
        private Integer stopAfterHours;

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder endpoint(String endpoint) { this.endpoint = endpoint; return this; }
        public Builder intervalMinutes(BigDecimal intervalMinutes) { this.intervalMinutes = intervalMinutes; return this; }
        public Builder intervalMinutes(double intervalMinutes) { return intervalMinutes(BigDecimal.valueOf(intervalMinutes)); }
        public Builder startAt(Instant startAt) { this.startAt = startAt; return this; }
        public Builder stopAt(Instant stopAt) { this.stopAt = stopAt; return this; }
        public Builder stopAfterHours(Integer stopAfterHours) { this.stopAfterHours = stopAfterHours; return this; }

        /** Accepts a JSON object (as a map) or the "key: value" line format. */
        public Builder params(Object params) { this.params = keyValues("params", params); return this; }

        /** Accepts a JSON object (as a map) or the "key: value" line format. */
        public Builder headers(Object headers) { this.headers = keyValues("headers", headers); return this; }

        public Builder additionalParams(Object additionalParams) {
            if (additionalParams != null && !(additionalParams instanceof Map)) {
                throw new InvalidConfigurationException("additional_params must be a JSON object");
            }
            this.additionalParams = copy((Map<?, ?>) additionalParams);
            return this;
        }

        public ConfigurationDraft build() {
            return new ConfigurationDraft(name, description, method, baseUrl, endpoint, params, headers,
                    additionalParams, intervalMinutes, startAt, stopAt, stopAfterHours);
        }

        private static Map<String, Object> keyValues(String field, Object value) {
            if (value == null) return new LinkedHashMap<>();
            if (value instanceof Map<?, ?> map) return copy(map);
            if (value instanceof String text) return KeyValueParser.parse(text);
            throw new InvalidConfigurationException(field + " must be a JSON object or \"key: value\" lines");
        }

        private static Map<String, Object> copy(Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            if (map != null) map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        }
    }
}

package org.apiwatch.store;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One monitored endpoint with its polling schedule.
 * {@code id} is the storage surrogate; {@code configId} is the identifier callers and results use.
 */
public record ApiConfiguration(
        long id,
        long configId,
        String apiKey,
        String name,
        String description,
        String method,
        String baseUrl,
        String endpoint,
        Map<String, Object> params,
        Map<String, Object> headers,
        Map<String, Object> additionalParams,
        boolean active,
        BigDecimal intervalMinutes,
        Instant startAt,
        Instant stopAt,
        Instant nextFireAt,
        Instant createdAt
) {

    private static final BigDecimal MILLIS_PER_MINUTE = BigDecimal.valueOf(60_000);

    public ApiConfiguration {
        params = params == null ? Map.of() : params;
        headers = headers == null ? Map.of() : headers;
        additionalParams = additionalParams == null ? Map.of() : additionalParams;
    }

    public Duration interval() {
        return Duration.ofMillis(intervalMinutes.multiply(MILLIS_PER_MINUTE).longValue());
    }

    public boolean ownedBy(String tenantKey) {
        if (tenantKey == null || apiKey == null) return false;
        return MessageDigest.isEqual(
                apiKey.getBytes(StandardCharsets.UTF_8),
                tenantKey.getBytes(StandardCharsets.UTF_8));
    }

    /** Fresh, not yet stored configuration; always created inactive. */
    public static ApiConfiguration draft(long configId, String apiKey, String name, String description,
                                         String method, String baseUrl, String endpoint,
                                         Map<String, Object> params, Map<String, Object> headers,
                                         Map<String, Object> additionalParams, BigDecimal intervalMinutes,
                                         Instant startAt, Instant stopAt, Instant createdAt) {
        return new ApiConfiguration(0L, configId, apiKey, name, description, method, baseUrl, endpoint,
                params, headers, additionalParams, false, intervalMinutes, startAt, stopAt, null, createdAt);
    }
}

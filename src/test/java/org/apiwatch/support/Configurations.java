package org.apiwatch.support;

import org.apiwatch.store.ApiConfiguration;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** Test fixtures. */
public final class Configurations {

    public static final String TENANT = "tenant-key-1";
    public static final String OTHER_TENANT = "tenant-key-2";

    private Configurations() {}

    public static ApiConfiguration inactive(long configId, double intervalMinutes, Instant startAt, Instant stopAt) {
        return inactive(configId, intervalMinutes, startAt, stopAt, startAt);
    }

    public static ApiConfiguration inactive(long configId, double intervalMinutes, Instant startAt, Instant stopAt,
                                            Instant createdAt) {
        return ApiConfiguration.draft(configId, TENANT, "Orders API " + configId, "orders endpoint", "GET",
                "https://api.example.com/", "/v1/orders", Map.of("status", "open"),
                Map.of("Accept", "application/json"), Map.of("page", 1),
                BigDecimal.valueOf(intervalMinutes), startAt, stopAt, createdAt);
    }
}

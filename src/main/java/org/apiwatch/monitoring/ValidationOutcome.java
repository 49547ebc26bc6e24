package org.apiwatch.monitoring;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;

public record ValidationOutcome(
        long configId,
        String name,
        int httpStatus,
        long responseTimeMs,
        JsonNode sampleResponse,
        Instant startAt,
        Instant stopAt,
        BigDecimal intervalMinutes
) {
}

package org.apiwatch.monitoring;

import java.math.BigDecimal;
import java.time.Instant;

public record ActivationResult(
        long configId,
        Instant nextFireAt,
        Instant stopAt,
        BigDecimal intervalMinutes,
        boolean alreadyActive
) {
}

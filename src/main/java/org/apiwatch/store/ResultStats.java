package org.apiwatch.store;

import java.time.Instant;

public record ResultStats(long total, long successful, Instant lastCalledAt) {

    public static final ResultStats EMPTY = new ResultStats(0, 0, null);

    public long failed() {
        return total - successful;
    }
}

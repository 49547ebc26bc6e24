package org.apiwatch.monitoring;

import org.apiwatch.store.ApiConfiguration;

import java.time.Duration;
import java.time.Instant;

/**
 * In-memory handle of an active configuration. Immutable; the scheduler swaps instances as the job advances.
 */
public record Job(long configId, Instant nextFireAt, Duration interval, Instant stopAt) {

    public static Job of(ApiConfiguration configuration, Instant nextFireAt) {
        return new Job(configuration.configId(), nextFireAt, configuration.interval(), configuration.stopAt());
    }

    public boolean isDue(Instant now) {
        return !nextFireAt.isAfter(now);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(stopAt);
    }

    public Instant followingBoundary() {
        return nextFireAt.plus(interval);
    }

    /** True once the next boundary would fall at or past the stop time. */
    public boolean isComplete() {
        return !nextFireAt.isBefore(stopAt);
    }

    public Job withNextFireAt(Instant next) {
        return new Job(configId, next, interval, stopAt);
    }

    /**
     * First boundary of the grid anchored at {@code anchor} that lies strictly after {@code now}.
     * Boundaries in between are skipped, not replayed. An anchor already in the future is returned as is.
     */
    public static Instant resume(Instant anchor, Duration interval, Instant now) {
        if (anchor.isAfter(now)) return anchor;
        long intervalMillis = interval.toMillis();
        long behind = now.toEpochMilli() - anchor.toEpochMilli();
        long steps = behind / intervalMillis + 1;
        return anchor.plusMillis(steps * intervalMillis);
    }
}

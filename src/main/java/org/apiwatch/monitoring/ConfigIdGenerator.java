package org.apiwatch.monitoring;

import java.security.SecureRandom;
import java.util.function.LongSupplier;

/**
 * Random nine-digit identifiers. Collisions are handled by the caller retrying with a new value.
 */
public class ConfigIdGenerator implements LongSupplier {

    private static final int LOWEST = 100_000_000;
    private static final int SPAN = 900_000_000;

    private final SecureRandom random = new SecureRandom();

    @Override
    public long getAsLong() {
        return LOWEST + random.nextInt(SPAN);
    }
}

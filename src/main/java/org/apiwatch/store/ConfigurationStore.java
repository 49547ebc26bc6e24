package org.apiwatch.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of monitoring configurations and their lifecycle.
 * All methods throw {@link StoreException} when the backing store fails.
 */
public interface ConfigurationStore {

    /**
     * @throws DuplicateConfigIdException when {@code configId} is already taken
     */
    ApiConfiguration insert(ApiConfiguration configuration);

    Optional<ApiConfiguration> findByConfigId(long configId);

    List<ApiConfiguration> findActive();

    /**
     * Flips an inactive configuration to active with its first boundary.
     *
     * @return false when the row is missing or was already active
     */
    boolean activate(long configId, Instant nextFireAt);

    /**
     * Marks the configuration inactive and clears its next boundary. Idempotent.
     *
     * @return false when the row does not exist
     */
    boolean deactivate(long configId);

    /**
     * Moves {@code next_fire_at} from {@code expected} to {@code next}, only while the row is active
     * and still holds {@code expected}. This is the claim that lets one scheduler execute a boundary.
     */
    boolean compareAndSetNextFire(long configId, Instant expected, Instant next);

    /**
     * Deletes configurations whose latest result (or creation time when they have none)
     * is before {@code cutoff}. Results go with them.
     *
     * @return number of configurations deleted
     */
    int deleteIdleSince(Instant cutoff);
}

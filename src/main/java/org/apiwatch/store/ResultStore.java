package org.apiwatch.store;

import java.util.List;

/**
 * Append-only record of call outcomes.
 */
public interface ResultStore {

    /**
     * @throws ConfigurationGoneException when the owning configuration no longer exists
     */
    CallResult insert(CallResult result);

    /**
     * Newest first. A non-positive limit returns every result.
     */
    List<CallResult> findByConfigId(long configId, int limit);

    ResultStats stats(long configId);
}

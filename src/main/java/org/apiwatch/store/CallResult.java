package org.apiwatch.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Outcome of one executed poll. Insert-only.
 * A successful call has no error message; a failed call usually has no response data.
 */
public record CallResult(
        long id,
        long configId,
        JsonNode responseData,
        boolean successful,
        String errorMessage,
        Integer httpStatus,
        Long responseTimeMs,
        Instant calledAt
) {

    public static CallResult success(long configId, JsonNode responseData, int httpStatus,
                                     long responseTimeMs, Instant calledAt) {
        return new CallResult(0L, configId, responseData, true, null, httpStatus, responseTimeMs, calledAt);
    }

    public static CallResult failure(long configId, String errorMessage, Long responseTimeMs, Instant calledAt) {
        return new CallResult(0L, configId, null, false,
                errorMessage == null ? "Call failed" : errorMessage, null, responseTimeMs, calledAt);
    }

    /**
     * Failed copy of this result without its response body. Status and response time are kept.
     */
    public CallResult withoutPayload(String reason) {
        return new CallResult(id, configId, null, false, reason, httpStatus, responseTimeMs, calledAt);
    }
}

package org.apiwatch.client;

public record ApiResponse(int status, String body, long latencyMillis) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}

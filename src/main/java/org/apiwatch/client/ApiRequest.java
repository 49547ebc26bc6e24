package org.apiwatch.client;

import org.apiwatch.store.ApiConfiguration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A fully resolved outbound call. {@code params} already include any additional params.
 */
public record ApiRequest(String method, String url, Map<String, Object> params, Map<String, String> headers) {

    public ApiRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ApiRequest from(ApiConfiguration configuration) {
        return of(configuration.method(), configuration.baseUrl(), configuration.endpoint(),
                configuration.params(), configuration.headers(), configuration.additionalParams());
    }

    public static ApiRequest of(String method, String baseUrl, String endpoint,
                                Map<String, Object> params, Map<String, Object> headers,
                                Map<String, Object> additionalParams) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (params != null) merged.putAll(params);
        if (additionalParams != null) merged.putAll(additionalParams);
        merged.values().removeIf(v -> v == null);

        Map<String, String> headerValues = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (v != null) headerValues.put(k, String.valueOf(v));
            });
        }
        return new ApiRequest(method, joinUrl(baseUrl, endpoint), merged, headerValues);
    }

    public static String joinUrl(String baseUrl, String endpoint) {
        String base = stripTrailing(baseUrl == null ? "" : baseUrl.strip());
        if (endpoint == null || endpoint.isBlank()) return base;
        return base + "/" + stripLeading(endpoint.strip());
    }

    public boolean sendsQueryString() {
        return "GET".equals(method);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    private static String stripLeading(String s) {
        int start = 0;
        while (start < s.length() && s.charAt(start) == '/') start++;
        return s.substring(start);
    }
}

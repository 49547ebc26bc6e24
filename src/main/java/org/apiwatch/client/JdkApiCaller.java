package org.apiwatch.client;

import org.apiwatch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * {@link ApiCaller} on top of {@link HttpClient}. HTTP/1.1, redirects followed.
 */
public class JdkApiCaller implements ApiCaller {

    private static final Logger logger = LoggerFactory.getLogger(JdkApiCaller.class);

    // HttpClient rejects these; it manages them itself.
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient client;
    private final Duration timeout;

    public JdkApiCaller(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public ApiResponse call(ApiRequest request) throws UpstreamCallException {
        long start = System.nanoTime();
        try {
            HttpRequest httpRequest = build(request);
            HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            long latency = elapsedMillis(start);
            logger.debug("{} {} -> {} in {}ms", request.method(), request.url(), response.statusCode(), latency);
            return new ApiResponse(response.statusCode(), response.body(), latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamCallException("Call interrupted", elapsedMillis(start), e);
        } catch (IOException | IllegalArgumentException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new UpstreamCallException(reason, elapsedMillis(start), e);
        }
    }

    HttpRequest build(ApiRequest request) {
        String url = request.url();
        HttpRequest.BodyPublisher body = HttpRequest.BodyPublishers.noBody();
        boolean hasContentType = false;

        if (request.sendsQueryString()) {
            url = appendQuery(url, request.params());
        } else {
            body = HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(request.params()), StandardCharsets.UTF_8);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .method(request.method(), body);

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(name)) {
                logger.debug("Skipping restricted header {}", header.getKey());
                continue;
            }
            if ("content-type".equals(name)) hasContentType = true;
            builder.header(header.getKey(), header.getValue());
        }
        if (!request.sendsQueryString() && !hasContentType) {
            builder.header("Content-Type", "application/json");
        }
        return builder.build();
    }

    static String appendQuery(String url, Map<String, Object> params) {
        if (params.isEmpty()) return url;
        StringJoiner query = new StringJoiner("&");
        params.forEach((k, v) -> query.add(encode(k) + "=" + encode(String.valueOf(v))));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

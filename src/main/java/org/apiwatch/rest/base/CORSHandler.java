package org.apiwatch.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.util.Arrays;

public class CORSHandler implements HttpHandler {

    private static final long PREFLIGHT_MAX_AGE_SECONDS = 86400;

    private final HttpHandler next;
    private final String[] allowedOrigins;

    public CORSHandler(HttpHandler next, String[] allowedOrigins) {
        this.next = next;
        this.allowedOrigins = allowedOrigins == null ? new String[0] : allowedOrigins;
    }

    /** Comma-separated list as found in config.xml. */
    public static String[] parseOrigins(String origins) {
        if (origins == null || origins.isBlank()) return new String[0];
        return Arrays.stream(origins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        boolean allowed = false;

        if (origin != null) {
            for (String o : allowedOrigins) {
                if (o.equals("*") || o.equalsIgnoreCase(origin)) {
                    allowed = true;
                    break;
                }
            }
        }

        if (allowed) {
            exchange.getResponseHeaders().put(new HttpString("Access-Control-Allow-Origin"), origin);
            exchange.getResponseHeaders().put(new HttpString("Access-Control-Allow-Methods"),
                    "GET, POST, OPTIONS");
            exchange.getResponseHeaders().put(new HttpString("Access-Control-Allow-Headers"),
                    "X-API-Key, Content-Type, Accept");
            exchange.getResponseHeaders().put(new HttpString("Access-Control-Max-Age"),
                    String.valueOf(PREFLIGHT_MAX_AGE_SECONDS));
            exchange.getResponseHeaders().put(Headers.VARY, "Origin");
        }

        if (exchange.getRequestMethod().equalToString("OPTIONS")) {
            exchange.setStatusCode(allowed ? 204 : 403);
            exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, "0");
            exchange.endExchange();
            return;
        }

        next.handleRequest(exchange);
    }
}

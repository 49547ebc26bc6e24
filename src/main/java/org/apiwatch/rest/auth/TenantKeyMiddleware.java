package org.apiwatch.rest.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.apiwatch.utils.ResponseUtil;

/**
 * Rejects requests without an X-API-Key header and attaches the key for the handler.
 */
public class TenantKeyMiddleware implements HttpHandler {

    public static final HttpString API_KEY_HEADER = HttpString.tryFromString("X-API-Key");

    private final HttpHandler next;

    public TenantKeyMiddleware(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String apiKey = exchange.getRequestHeaders().getFirst(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Missing X-API-Key header");
            return;
        }
        exchange.putAttachment(TenantContext.ATTACHMENT_KEY, new TenantContext(apiKey.strip()));
        next.handleRequest(exchange);
    }
}

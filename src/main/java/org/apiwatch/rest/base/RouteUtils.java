package org.apiwatch.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.apiwatch.rest.auth.TenantKeyMiddleware;

public class RouteUtils {

    private RouteUtils() {}

    /**
     * Route that does not require an API key.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(new BlockingHandler(handler));
    }

    /**
     * Route that requires the X-API-Key header. The key is attached as a TenantContext.
     */
    public static HttpHandler tenantRoute(HttpHandler handler) {
        return new Dispatcher(new BlockingHandler(new TenantKeyMiddleware(handler)));
    }
}

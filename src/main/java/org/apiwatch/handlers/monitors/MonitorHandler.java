package org.apiwatch.handlers.monitors;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.apiwatch.config.utils.LogContext;
import org.apiwatch.monitoring.InvalidConfigurationException;
import org.apiwatch.monitoring.MonitoringException;
import org.apiwatch.rest.auth.TenantContext;
import org.apiwatch.utils.HttpRequestUtil;
import org.apiwatch.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the /monitors handlers. Monitoring errors become their HTTP status; anything else is a logged 500.
 */
public abstract class MonitorHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(MonitorHandler.class);

    @Override
    public final void handleRequest(HttpServerExchange exchange) {
        LogContext.start(getClass().getSimpleName());
        try {
            TenantContext tenant = exchange.getAttachment(TenantContext.ATTACHMENT_KEY);
            if (tenant == null) {
                ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Missing X-API-Key header");
                return;
            }
            handle(exchange, tenant.getApiKey());
        } catch (MonitoringException e) {
            logger.info("{} {} -> {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                    e.getStatusCode(), e.getMessage());
            ResponseUtil.sendError(exchange, e.getStatusCode(), e.getMessage());
        } catch (Exception e) {
            logger.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal Server Error");
        } finally {
            LogContext.clear();
        }
    }

    protected abstract void handle(HttpServerExchange exchange, String tenantKey) throws Exception;

    protected static long configId(HttpServerExchange exchange) {
        String raw = HttpRequestUtil.getParam(exchange, "configId");
        if (raw != null && !raw.isEmpty() && raw.length() <= 18 && raw.chars().allMatch(Character::isDigit)) {
            long id = Long.parseLong(raw);
            if (id > 0) return id;
        }
        throw new InvalidConfigurationException("configId must be a positive integer");
    }
}

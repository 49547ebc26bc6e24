package org.apiwatch.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.apiwatch.handlers.HealthCheckHandler;
import org.apiwatch.handlers.monitors.ActivateMonitoringHandler;
import org.apiwatch.handlers.monitors.DeactivateMonitoringHandler;
import org.apiwatch.handlers.monitors.GetMonitoringResultsHandler;
import org.apiwatch.handlers.monitors.ValidateConfigurationHandler;
import org.apiwatch.rest.base.Dispatcher;
import org.apiwatch.rest.base.FallBack;
import org.apiwatch.rest.base.InvalidMethod;
import org.apiwatch.services.ServiceRegistry;

import static org.apiwatch.rest.base.RouteUtils.publicRoute;
import static org.apiwatch.rest.base.RouteUtils.tenantRoute;

public class Routes {

    private Routes() {}

    public static RoutingHandler monitors(ServiceRegistry registry) {
        return Handlers.routing()
                .post("/validate", tenantRoute(new ValidateConfigurationHandler(registry.validator())))
                .post("/{configId}/activate", tenantRoute(new ActivateMonitoringHandler(registry.scheduler())))
                .post("/{configId}/deactivate", tenantRoute(new DeactivateMonitoringHandler(registry.scheduler())))
                .get("/{configId}/results", tenantRoute(new GetMonitoringResultsHandler(registry.retrieval())))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    public static RoutingHandler system(ServiceRegistry registry) {
        return Handlers.routing()
                .get("/health", publicRoute(new HealthCheckHandler(registry.scheduler())))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}

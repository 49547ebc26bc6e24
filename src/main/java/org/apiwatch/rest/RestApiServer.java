package org.apiwatch.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import org.apiwatch.config.XmlConfiguration;
import org.apiwatch.rest.base.CORSHandler;
import org.apiwatch.rest.base.Dispatcher;
import org.apiwatch.rest.base.FallBack;
import org.apiwatch.services.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    public static Undertow startUndertow(XmlConfiguration cfg, ServiceRegistry registry) {
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }

        HttpHandler root = new CORSHandler(
                routes(cfg.server.basePath, registry),
                CORSHandler.parseOrigins(cfg.server.allowedOrigins));

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(cfg.server.ioThreads > 0 ? cfg.server.ioThreads : 2)
                .setWorkerThreads(cfg.server.workerThreads > 0 ? cfg.server.workerThreads : 16)
                .addHttpListener(cfg.server.port, cfg.server.host)
                .setHandler(root)
                .build();

        server.start();
        logger.info("""
                        \s
                        APIWATCH MONITORING REST API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        \s""",
                cfg.server.host, cfg.server.port, cfg.server.basePath);
        return server;
    }

    public static PathHandler routes(String basePath, ServiceRegistry registry) {
        String base = basePath == null ? "" : basePath;
        return Handlers.path(new Dispatcher(new FallBack()))
                .addPrefixPath(base + "/monitors", Routes.monitors(registry))
                .addPrefixPath(base + "/system", Routes.system(registry));
    }
}

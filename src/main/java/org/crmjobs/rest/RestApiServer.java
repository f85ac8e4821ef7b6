package org.crmjobs.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.crmjobs.config.XmlConfiguration;
import org.crmjobs.rest.base.UnmatchedRouteHandler;
import org.crmjobs.services.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Admin HTTP surface: health, job statuses and run-now.
 */
public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    public static Undertow startUndertow(XmlConfiguration.Server cfg, TaskScheduler scheduler, String adminToken) {
        if (cfg == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        String basePath = cfg.basePath != null ? cfg.basePath : "";

        PathHandler pathHandler = Handlers.path(UnmatchedRouteHandler.notFound(Routes.ALL_ROUTES))
                .addPrefixPath(basePath + "/system", Routes.system(scheduler))
                .addPrefixPath(basePath + "/jobs", Routes.jobs(scheduler, adminToken));

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(cfg.ioThreads)
                .setWorkerThreads(cfg.workerThreads)
                .addHttpListener(cfg.port, cfg.host)
                .setHandler(pathHandler)
                .build();

        try {
            server.start();
        } catch (RuntimeException e) {
            logger.error("Error starting admin server: {}", e.getMessage());
            throw new IllegalStateException("Failed to start admin server on " + cfg.host + ":" + cfg.port, e);
        }

        if (adminToken == null) {
            logger.warn("CRM_ADMIN_TOKEN is not set, run-now over HTTP is disabled");
        }
        logger.info("""
                        
                        CRM JOBS ADMIN API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        """,
                cfg.host, cfg.port, basePath);
        return server;
    }
}

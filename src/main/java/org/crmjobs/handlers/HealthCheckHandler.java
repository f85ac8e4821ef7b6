package org.crmjobs.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.crmjobs.config.database.DatabaseManager;
import org.crmjobs.services.TaskScheduler;
import org.crmjobs.utils.ResponseUtil;
import org.crmjobs.utils.security.KeyProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for the health check endpoint.
 * Returns  -  basic app info,
 *          -  database status,
 *          -  scheduled job statuses.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final TaskScheduler scheduler;

    public HealthCheckHandler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "CRM Jobs");
        response.put("version", "1.0.0");
        response.put("environment", KeyProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());

        response.put("database", "PostgreSQL");
        response.put("database_status", DatabaseManager.isReachable() ? "connected" : "unavailable");

        response.put("scheduler_status", schedulerStatus());
        response.put("jobs", scheduler.statuses());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }

    private String schedulerStatus() {
        if (scheduler.isStopped()) return "stopped";
        return scheduler.isStarted() ? "running" : "not_started";
    }
}

package org.crmjobs.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.crmjobs.handlers.HealthCheckHandler;
import org.crmjobs.handlers.jobs.ListJobsHandler;
import org.crmjobs.handlers.jobs.RunJobHandler;
import org.crmjobs.services.TaskScheduler;

import static org.crmjobs.rest.base.RouteUtils.adminRoute;
import static org.crmjobs.rest.base.RouteUtils.publicRoute;
import static org.crmjobs.rest.base.UnmatchedRouteHandler.methodNotAllowed;
import static org.crmjobs.rest.base.UnmatchedRouteHandler.notFound;

public class Routes {
    static final String SYSTEM_ROUTES = "GET /system/health";
    static final String JOB_ROUTES = "GET /jobs, POST /jobs/{name}/run";
    static final String ALL_ROUTES = SYSTEM_ROUTES + ", " + JOB_ROUTES;

    private Routes() {}

    public static RoutingHandler system(TaskScheduler scheduler) {
        return Handlers.routing()
                .get("/health", publicRoute(new HealthCheckHandler(scheduler)))
                .setInvalidMethodHandler(methodNotAllowed(SYSTEM_ROUTES))
                .setFallbackHandler(notFound(SYSTEM_ROUTES));
    }

    public static RoutingHandler jobs(TaskScheduler scheduler, String adminToken) {
        return Handlers.routing()
                .get("", publicRoute(new ListJobsHandler(scheduler)))
                .post("/{name}/run", adminRoute(new RunJobHandler(scheduler), adminToken))
                .setInvalidMethodHandler(methodNotAllowed(JOB_ROUTES))
                .setFallbackHandler(notFound(JOB_ROUTES));
    }
}

package org.crmjobs.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.crmjobs.rest.auth.AdminTokenMiddleware;

public class RouteUtils {
    private RouteUtils() {}

    /**
     * Read-only route, no token needed.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(
                new BlockingHandler(handler)
        );
    }

    /**
     * Route that changes state; requires the admin token.
     */
    public static HttpHandler adminRoute(HttpHandler handler, String adminToken) {
        return new Dispatcher(
                new BlockingHandler(
                        new AdminTokenMiddleware(handler, adminToken)
                )
        );
    }
}

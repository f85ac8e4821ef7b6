package org.crmjobs.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.crmjobs.utils.ResponseUtil;

/**
 * Answers requests no admin route accepts: 404 for an unknown path, 405 for a known path
 * called with the wrong method. The error message lists the routes that do exist.
 */
public class UnmatchedRouteHandler implements HttpHandler {

    private final int status;
    private final String availableRoutes;

    private UnmatchedRouteHandler(int status, String availableRoutes) {
        this.status = status;
        this.availableRoutes = availableRoutes;
    }

    public static HttpHandler notFound(String availableRoutes) {
        return new Dispatcher(new UnmatchedRouteHandler(StatusCodes.NOT_FOUND, availableRoutes));
    }

    public static HttpHandler methodNotAllowed(String availableRoutes) {
        return new Dispatcher(new UnmatchedRouteHandler(StatusCodes.METHOD_NOT_ALLOWED, availableRoutes));
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String request = exchange.getRequestMethod() + " " + exchange.getRequestURI();
        String problem = status == StatusCodes.METHOD_NOT_ALLOWED
                ? "Method not allowed: " + request
                : "No admin route for " + request;
        ResponseUtil.sendError(exchange, status, problem + ". Available: " + availableRoutes);
    }
}

package org.crmjobs.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Moves request handling off the IO thread onto an Undertow worker thread.
 * Handlers behind it may block (JDBC, running a job).
 */
public class Dispatcher implements HttpHandler {
    private final HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    public void handleRequest(HttpServerExchange exchange) throws Exception {
        exchange.dispatch(this.handler);
    }
}

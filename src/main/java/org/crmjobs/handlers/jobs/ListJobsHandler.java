package org.crmjobs.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.crmjobs.services.TaskScheduler;
import org.crmjobs.utils.ResponseUtil;

public class ListJobsHandler implements HttpHandler {

    private final TaskScheduler scheduler;

    public ListJobsHandler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendSuccess(exchange, "Jobs retrieved", scheduler.statuses());
    }
}

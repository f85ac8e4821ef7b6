package org.crmjobs.handlers.jobs;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.crmjobs.services.JobAlreadyRunningException;
import org.crmjobs.services.JobNotFoundException;
import org.crmjobs.services.JobResult;
import org.crmjobs.services.TaskScheduler;
import org.crmjobs.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;

/**
 * Runs a job immediately, outside its schedule, and returns its result.
 * The request blocks until the job finishes.
 */
public class RunJobHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(RunJobHandler.class);

    private final TaskScheduler scheduler;

    public RunJobHandler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Deque<String> nameParam = exchange.getQueryParameters().get("name");
        if (nameParam == null || nameParam.isEmpty() || nameParam.getFirst().isBlank()) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Job name is required");
            return;
        }
        String name = nameParam.getFirst();

        try {
            JobResult result = scheduler.runNow(name);
            String message = result.isSuccess() ? "Job completed" : "Job failed";
            ResponseUtil.sendSuccess(exchange, message, result);
        } catch (JobNotFoundException e) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (JobAlreadyRunningException e) {
            ResponseUtil.sendError(exchange, StatusCodes.CONFLICT, e.getMessage());
        } catch (Exception e) {
            logger.error("Run-now of job {} failed: {}", name, e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Job run failed");
        }
    }
}

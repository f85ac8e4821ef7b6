package org.crmjobs.services.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import org.crmjobs.services.RecurrenceRule;
import org.crmjobs.services.ScheduledTask;
import org.crmjobs.stats.FetchException;
import org.crmjobs.stats.GraphQlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Records that the CRM job process is alive and whether the GraphQL endpoint answers.
 * An unreachable endpoint is reported in the summary, never as a failed heartbeat.
 */
public class CrmHeartbeatTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(CrmHeartbeatTask.class);

    public static final String DEFAULT_NAME = "crm-heartbeat";
    public static final RecurrenceRule DEFAULT_SCHEDULE = RecurrenceRule.everyMinutes(5);

    static final String HELLO_QUERY = "query { hello }";
    private static final int MAX_ERROR_LENGTH = 100;

    private final String name;
    private final RecurrenceRule recurrence;
    private final GraphQlClient client;

    public CrmHeartbeatTask(GraphQlClient client) {
        this(DEFAULT_NAME, DEFAULT_SCHEDULE, client);
    }

    public CrmHeartbeatTask(String name, RecurrenceRule recurrence, GraphQlClient client) {
        this.name = name;
        this.recurrence = recurrence;
        this.client = client;
    }

    @Override public String name() { return name; }
    @Override public RecurrenceRule recurrence() { return recurrence; }

    @Override
    public String execute(Instant now) {
        return "CRM is alive | " + graphQlStatus();
    }

    private String graphQlStatus() {
        try {
            JsonNode data = client.execute(HELLO_QUERY);
            JsonNode hello = data.get("hello");
            if (hello != null && !hello.isNull()) {
                return "GraphQL: " + hello.asText();
            }
            return "GraphQL: No response";
        } catch (FetchException e) {
            logger.warn("GraphQL endpoint check failed: {}", e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (message.length() > MAX_ERROR_LENGTH) {
                message = message.substring(0, MAX_ERROR_LENGTH);
            }
            return "GraphQL Error: " + message;
        }
    }
}

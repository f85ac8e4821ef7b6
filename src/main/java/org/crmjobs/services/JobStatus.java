package org.crmjobs.services;

import java.time.Instant;

/**
 * Point-in-time view of one registered job, used by the health and jobs endpoints.
 */
public record JobStatus(String name,
                        String schedule,
                        boolean running,
                        Instant lastRunAt,
                        Instant nextRunAt,
                        JobResult.Outcome lastOutcome,
                        String lastMessage,
                        long successCount,
                        long failureCount) {
}

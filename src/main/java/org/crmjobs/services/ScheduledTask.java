package org.crmjobs.services;

import java.time.Instant;

public interface ScheduledTask {
    /**
     * Unique name used for registration, run-now and log routing.
     */
    String name();

    /**
     * When the scheduler should trigger this task.
     */
    RecurrenceRule recurrence();

    /**
     * The work to do. Returns the human-readable summary on success.
     * Implementations throw on failure; the scheduler turns the exception into a FAILURE result.
     */
    String execute(Instant now) throws Exception;
}

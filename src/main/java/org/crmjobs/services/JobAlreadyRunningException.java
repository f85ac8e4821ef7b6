package org.crmjobs.services;

/**
 * Thrown by run-now when the job already has an execution in flight.
 */
public class JobAlreadyRunningException extends IllegalStateException {

    public JobAlreadyRunningException(String jobName) {
        super("Job is already running: " + jobName);
    }
}

package org.crmjobs.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one job execution.
 * Exactly one is produced per triggered execution, success or failure.
 */
public record JobResult(String jobName,
                        Instant startedAt,
                        Instant finishedAt,
                        Outcome outcome,
                        String summary,
                        String error) {

    public enum Outcome { SUCCESS, FAILURE }

    public JobResult {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static JobResult success(String jobName, Instant startedAt, Instant finishedAt, String summary) {
        return new JobResult(jobName, startedAt, finishedAt, Outcome.SUCCESS, summary, null);
    }

    public static JobResult failure(String jobName, Instant startedAt, Instant finishedAt, String error) {
        return new JobResult(jobName, startedAt, finishedAt, Outcome.FAILURE, null, error);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /**
     * The text written after the timestamp in the execution log.
     */
    public String message() {
        return isSuccess() ? summary : "ERROR: " + error;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}

package org.crmjobs.services.log;

import org.crmjobs.services.JobResult;

/**
 * Append-only target for job execution results, one entry per execution.
 */
public interface ExecutionLogSink {

    void append(JobResult result) throws LogSinkException;
}

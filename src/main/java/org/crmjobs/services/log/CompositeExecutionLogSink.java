package org.crmjobs.services.log;

import org.crmjobs.services.JobResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends every result to all delegates. A failing delegate does not stop the others;
 * failures are reported together once all delegates have been tried.
 */
public class CompositeExecutionLogSink implements ExecutionLogSink {

    private final List<ExecutionLogSink> sinks = new ArrayList<>();

    public CompositeExecutionLogSink addSink(ExecutionLogSink sink) {
        sinks.add(sink);
        return this;
    }

    public int size() {
        return sinks.size();
    }

    @Override
    public void append(JobResult result) throws LogSinkException {
        LogSinkException failure = null;
        for (ExecutionLogSink sink : sinks) {
            try {
                sink.append(result);
            } catch (LogSinkException | RuntimeException e) {
                if (failure == null) {
                    failure = new LogSinkException("Failed to record result of " + result.jobName() + ": " + e.getMessage(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

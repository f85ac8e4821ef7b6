package org.crmjobs.services;

public class DuplicateJobException extends IllegalArgumentException {

    public DuplicateJobException(String jobName) {
        super("Job already registered: " + jobName);
    }
}

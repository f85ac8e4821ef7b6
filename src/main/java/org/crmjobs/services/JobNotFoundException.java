package org.crmjobs.services;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {

    public JobNotFoundException(String jobName) {
        super("No job registered with name: " + jobName);
    }
}

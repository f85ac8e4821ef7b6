package org.crmjobs.data;

/**
 * Data-access failure. Wraps the underlying cause, usually an SQLException.
 */
public class RepositoryException extends Exception {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}

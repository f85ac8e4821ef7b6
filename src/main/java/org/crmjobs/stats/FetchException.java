package org.crmjobs.stats;

/**
 * Retrieval of remote or aggregated data failed: unreachable endpoint, timeout,
 * unexpected HTTP status, GraphQL errors or a response that does not match the expected shape.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

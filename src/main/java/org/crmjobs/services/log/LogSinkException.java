package org.crmjobs.services.log;

/**
 * Raised when an execution could not be recorded. Diagnostic only:
 * it never changes the outcome of the job it was recording.
 */
public class LogSinkException extends Exception {

    public LogSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.carball.jobcluster.parser;

/**
 * Raised when a job log source cannot deliver the complete list of jobs.
 * Callers must not cluster a partial result.
 */
public class JobLogSourceException extends Exception {

    public JobLogSourceException(String message) {
        super(message);
    }

    public JobLogSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

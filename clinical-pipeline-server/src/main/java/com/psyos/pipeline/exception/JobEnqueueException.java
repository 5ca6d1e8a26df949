package com.psyos.pipeline.exception;

/**
 * The broker did not acknowledge a job in time. Transient: the caller's own job is retried.
 */
public class JobEnqueueException extends RuntimeException {

    public JobEnqueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

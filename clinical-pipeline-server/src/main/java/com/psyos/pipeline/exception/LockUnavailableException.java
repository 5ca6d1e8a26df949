package com.psyos.pipeline.exception;

/**
 * A distributed lock could not be acquired within its wait window. Jobs failing with
 * this exception are retried.
 */
public class LockUnavailableException extends RuntimeException {

    public LockUnavailableException(String lockKey) {
        super("Lock not acquired: " + lockKey);
    }

    public LockUnavailableException(String lockKey, Throwable cause) {
        super("Lock not acquired: " + lockKey, cause);
    }
}

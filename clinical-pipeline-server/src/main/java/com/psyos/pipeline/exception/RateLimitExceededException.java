package com.psyos.pipeline.exception;

public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String key) {
        super("Rate limit exceeded: key=" + key);
    }
}

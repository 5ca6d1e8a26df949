package com.psyos.pipeline.exception;

/**
 * Missing, invalid or expired credentials.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}

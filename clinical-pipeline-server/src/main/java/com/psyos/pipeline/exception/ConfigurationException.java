package com.psyos.pipeline.exception;

/**
 * Required process configuration (master key, provider credentials) is missing or invalid.
 * Fatal at the call site and never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.psyos.pipeline.exception;

/**
 * An external provider (language model or messaging channel) failed or returned unusable output.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

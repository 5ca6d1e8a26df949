package com.psyos.pipeline.exception;

/**
 * AEAD authentication failed: the ciphertext, nonce or tag was altered, or the wrong key was used.
 * The operation that triggered the decrypt must abort.
 */
public class IntegrityException extends RuntimeException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}

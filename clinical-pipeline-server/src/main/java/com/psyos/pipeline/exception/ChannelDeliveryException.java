package com.psyos.pipeline.exception;

/**
 * The external messaging channel rejected or failed an outbound send. Rethrown so the job is retried.
 */
public class ChannelDeliveryException extends ProviderException {

    public ChannelDeliveryException(String message) {
        super(message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

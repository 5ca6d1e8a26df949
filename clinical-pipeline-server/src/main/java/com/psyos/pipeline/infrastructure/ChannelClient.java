package com.psyos.pipeline.infrastructure;

/**
 * External messaging channel (WhatsApp gateway).
 */
public interface ChannelClient {

    /**
     * @throws com.psyos.pipeline.exception.ChannelDeliveryException when the send fails
     */
    void sendText(String toPhone, String text);
}

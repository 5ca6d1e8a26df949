package com.psyos.pipeline.exception;

import lombok.Getter;

/**
 * The channel delivered a message whose external id is already stored for the tenant.
 * Callers treat this as a successful no-op.
 */
@Getter
public class DuplicateDeliveryException extends RuntimeException {

    private final String tenantId;
    private final String externalMessageId;

    public DuplicateDeliveryException(String tenantId, String externalMessageId, Throwable cause) {
        super("Duplicate delivery: tenantId=" + tenantId + ", externalMessageId=" + externalMessageId, cause);
        this.tenantId = tenantId;
        this.externalMessageId = externalMessageId;
    }
}

package com.psyos.pipeline.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the outbound queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundJob {

    private String tenantId;
    private String conversationId;
    private String messageId;
}

package com.psyos.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Payload of the inbound queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InboundJob {

    private String tenantId;
    private String externalMessageId;
    private String fromPhone;

    @ToString.Exclude
    private String text;

    private MessageSource source;
}

package com.psyos.pipeline.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyUpdateRequest {

    private String tenantId;
    /** tenant, user or conversation; tenant scope is rejected */
    private String scope;
    private String ownerUserId;
    private String conversationId;
    private String policyText;
    private PolicyFlags flags;
}

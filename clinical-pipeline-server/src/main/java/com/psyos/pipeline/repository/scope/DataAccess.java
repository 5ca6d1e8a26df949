package com.psyos.pipeline.repository.scope;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Description of one store access, checked by {@link TenantScopeGuard} before it runs.
 */
@Value
@Builder
public class DataAccess {

    String entity;
    DataOperation operation;
    String callerTenantId;
    ScopeFilter filter;

    @Singular
    List<? extends TenantOwned> payloads;
}

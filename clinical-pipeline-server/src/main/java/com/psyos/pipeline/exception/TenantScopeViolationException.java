package com.psyos.pipeline.exception;

import lombok.Getter;

/**
 * A data access reached the store layer without a filter restricting it to the caller's tenant.
 * This is a programming error; it is raised before the query executes.
 */
@Getter
public class TenantScopeViolationException extends RuntimeException {

    private final String entity;
    private final String operation;

    public TenantScopeViolationException(String entity, String operation, String detail) {
        super("Tenant scope missing for " + entity + "." + operation + ": " + detail);
        this.entity = entity;
        this.operation = operation;
    }
}

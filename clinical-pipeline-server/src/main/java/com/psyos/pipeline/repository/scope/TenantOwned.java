package com.psyos.pipeline.repository.scope;

/**
 * Entity carrying the tenant that owns it. Every tenant-scoped store only persists TenantOwned rows.
 */
public interface TenantOwned {

    String TENANT_FIELD = "tenantId";

    String getTenantId();
}

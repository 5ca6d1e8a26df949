package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AuditLog;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

@Component
public class AuditLogStore {

    private final TenantScopedStore<AuditLog> store;

    public AuditLogStore(AuditLogRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(AuditLog.class, repository, guard);
    }

    public AuditLog create(String tenantId, AuditLog entry) {
        return store.create(tenantId, entry);
    }

    public List<AuditLog> findByAction(String tenantId, String action, int limit) {
        return store.findMany(tenantId, tenantAnd(tenantId, eq("action", action)),
                Sort.by(Sort.Direction.DESC, "createdAt"), limit);
    }
}

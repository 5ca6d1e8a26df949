package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

/**
 * Tenant-scoped reads of clinician and patient accounts.
 */
@Component
public class UserDirectory {

    private final TenantScopedStore<UserEntity> store;

    public UserDirectory(UserRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(UserEntity.class, repository, guard);
    }

    public UserEntity create(String tenantId, UserEntity user) {
        return store.create(tenantId, user);
    }

    public Optional<UserEntity> findById(String tenantId, String userId) {
        return store.findUnique(tenantId, tenantAnd(tenantId, eq("id", userId)));
    }

    public Optional<UserEntity> findPatientByPhone(String tenantId, String phoneE164) {
        return store.findFirst(tenantId,
                tenantAnd(tenantId, eq("role", UserRole.PATIENT), eq("phoneE164", phoneE164)),
                Sort.by("createdAt"));
    }
}

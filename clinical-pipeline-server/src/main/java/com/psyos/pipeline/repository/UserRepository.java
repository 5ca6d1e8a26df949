package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends TenantScopedRepository<UserEntity> {

    /**
     * Unscoped lookup by global email. Only {@link com.psyos.pipeline.repository.scope.CrossTenantLoginLookup}
     * may call this.
     */
    Optional<UserEntity> findFirstByEmailIgnoreCase(String email);
}

package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AiPolicyRepository extends TenantScopedRepository<AiPolicyEntity> {
}

package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends TenantScopedRepository<ConversationEntity> {
}

package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MessageRepository extends TenantScopedRepository<MessageEntity> {
}

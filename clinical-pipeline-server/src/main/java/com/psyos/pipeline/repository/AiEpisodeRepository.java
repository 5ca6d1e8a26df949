package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AiEpisodeRepository extends TenantScopedRepository<AiEpisodeEntity> {
}

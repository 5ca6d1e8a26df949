package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.WeeklySummaryEntity;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WeeklySummaryRepository extends TenantScopedRepository<WeeklySummaryEntity> {
}

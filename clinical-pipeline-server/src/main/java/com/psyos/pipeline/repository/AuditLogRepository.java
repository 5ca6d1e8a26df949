package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AuditLog;
import com.psyos.pipeline.repository.scope.TenantScopedRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditLogRepository extends TenantScopedRepository<AuditLog> {
}

package com.psyos.pipeline.repository.scope;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

/**
 * Base for Spring Data repositories of tenant-owned entities. Application code never calls
 * these directly; it goes through a {@link TenantScopedStore}.
 */
@NoRepositoryBean
public interface TenantScopedRepository<T extends TenantOwned>
        extends JpaRepository<T, String>, JpaSpecificationExecutor<T> {
}

package com.psyos.pipeline.repository.scope;

import com.psyos.pipeline.exception.TenantScopeViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Guarded data access for one entity type. Every operation takes the caller's tenant id,
 * is described to the {@link TenantScopeGuard} and only then reaches the repository.
 */
public class TenantScopedStore<T extends TenantOwned> {

    private final String entity;
    private final TenantScopedRepository<T> repository;
    private final TenantScopeGuard guard;

    public TenantScopedStore(Class<T> entityType, TenantScopedRepository<T> repository, TenantScopeGuard guard) {
        this.entity = entityType.getSimpleName();
        this.repository = repository;
        this.guard = guard;
    }

    public T create(String tenantId, T row) {
        guard.check(access(DataOperation.CREATE, tenantId, null).payload(row).build());
        return repository.saveAndFlush(row);
    }

    public List<T> createMany(String tenantId, List<T> rows) {
        guard.check(access(DataOperation.CREATE_MANY, tenantId, null).payloads(rows).build());
        return repository.saveAllAndFlush(rows);
    }

    public Optional<T> findFirst(String tenantId, ScopeFilter filter, Sort sort) {
        guard.check(access(DataOperation.FIND_FIRST, tenantId, filter).build());
        return repository.findAll(spec(filter), PageRequest.of(0, 1, sort)).stream().findFirst();
    }

    public Optional<T> findUnique(String tenantId, ScopeFilter filter) {
        guard.check(access(DataOperation.FIND_UNIQUE, tenantId, filter).build());
        return repository.findOne(spec(filter));
    }

    public List<T> findMany(String tenantId, ScopeFilter filter, Sort sort, int limit) {
        guard.check(access(DataOperation.FIND_MANY, tenantId, filter).build());
        return repository.findAll(spec(filter), PageRequest.of(0, limit, sort)).getContent();
    }

    public long count(String tenantId, ScopeFilter filter) {
        guard.check(access(DataOperation.COUNT, tenantId, filter).build());
        return repository.count(spec(filter));
    }

    public Optional<T> update(String tenantId, ScopeFilter filter, Consumer<T> mutation) {
        guard.check(access(DataOperation.UPDATE, tenantId, filter).build());
        return repository.findOne(spec(filter)).map(row -> {
            applyWithinTenant(tenantId, DataOperation.UPDATE, row, mutation);
            return repository.saveAndFlush(row);
        });
    }

    public int updateMany(String tenantId, ScopeFilter filter, Consumer<T> mutation) {
        guard.check(access(DataOperation.UPDATE_MANY, tenantId, filter).build());
        List<T> rows = repository.findAll(spec(filter));
        rows.forEach(row -> applyWithinTenant(tenantId, DataOperation.UPDATE_MANY, row, mutation));
        repository.saveAllAndFlush(rows);
        return rows.size();
    }

    public boolean delete(String tenantId, ScopeFilter filter) {
        guard.check(access(DataOperation.DELETE, tenantId, filter).build());
        Optional<T> row = repository.findOne(spec(filter));
        row.ifPresent(repository::delete);
        return row.isPresent();
    }

    public int deleteMany(String tenantId, ScopeFilter filter) {
        guard.check(access(DataOperation.DELETE_MANY, tenantId, filter).build());
        List<T> rows = repository.findAll(spec(filter));
        repository.deleteAll(rows);
        return rows.size();
    }

    /**
     * Updates the row matching the filter, or creates the supplied one when none matches.
     */
    public T upsert(String tenantId, ScopeFilter filter, Supplier<T> creator, Consumer<T> mutation) {
        T created = creator.get();
        guard.check(access(DataOperation.UPSERT, tenantId, filter).payload(created).build());
        Optional<T> existing = repository.findOne(spec(filter));
        if (existing.isPresent()) {
            T row = existing.get();
            applyWithinTenant(tenantId, DataOperation.UPSERT, row, mutation);
            return repository.saveAndFlush(row);
        }
        return repository.saveAndFlush(created);
    }

    private void applyWithinTenant(String tenantId, DataOperation operation, T row, Consumer<T> mutation) {
        mutation.accept(row);
        if (!tenantId.equals(row.getTenantId())) {
            throw new TenantScopeViolationException(entity, operation.name(), "mutation changed tenantId");
        }
    }

    private DataAccess.DataAccessBuilder access(DataOperation operation, String tenantId, ScopeFilter filter) {
        return DataAccess.builder()
                .entity(entity)
                .operation(operation)
                .callerTenantId(tenantId)
                .filter(filter);
    }

    private Specification<T> spec(ScopeFilter filter) {
        return ScopeFilterSpecifications.toSpecification(filter);
    }
}

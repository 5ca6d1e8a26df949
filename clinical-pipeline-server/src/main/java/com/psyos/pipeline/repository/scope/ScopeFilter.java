package com.psyos.pipeline.repository.scope;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Typed query filter understood by both the tenant scope guard and the JPA translation.
 * The guard inspects exactly the tree that is later executed.
 */
public interface ScopeFilter {

    static ScopeFilter tenant(String tenantId) {
        return new FieldEquals(TenantOwned.TENANT_FIELD, tenantId);
    }

    static ScopeFilter eq(String field, Object value) {
        return new FieldEquals(field, value);
    }

    static ScopeFilter isNull(String field) {
        return new FieldIsNull(field);
    }

    /**
     * {@code from <= field < to}.
     */
    static ScopeFilter within(String field, Instant from, Instant to) {
        return new InstantRange(field, from, to);
    }

    static ScopeFilter and(ScopeFilter... filters) {
        return new And(List.of(filters));
    }

    static ScopeFilter or(ScopeFilter... filters) {
        return new Or(List.of(filters));
    }

    static ScopeFilter not(ScopeFilter filter) {
        return new Not(filter);
    }

    /**
     * Shorthand for the common case: tenant filter AND'ed with the given conditions.
     */
    static ScopeFilter tenantAnd(String tenantId, ScopeFilter... conditions) {
        ScopeFilter[] all = new ScopeFilter[conditions.length + 1];
        all[0] = tenant(tenantId);
        System.arraycopy(conditions, 0, all, 1, conditions.length);
        return new And(List.of(all));
    }

    @Value
    class FieldEquals implements ScopeFilter {
        String field;
        Object value;
    }

    @Value
    class FieldIsNull implements ScopeFilter {
        String field;
    }

    @Value
    class InstantRange implements ScopeFilter {
        String field;
        Instant from;
        Instant to;
    }

    @Value
    class And implements ScopeFilter {
        List<ScopeFilter> filters;
    }

    @Value
    class Or implements ScopeFilter {
        List<ScopeFilter> filters;
    }

    @Value
    class Not implements ScopeFilter {
        ScopeFilter filter;
    }
}

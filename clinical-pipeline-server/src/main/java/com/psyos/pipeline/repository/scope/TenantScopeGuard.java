package com.psyos.pipeline.repository.scope;

import com.psyos.pipeline.exception.TenantScopeViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Fails closed on any store access that is not restricted to the caller's tenant.
 *
 * A filter is scoped for tenant T when it is eq(tenantId, T), an AND with at least one
 * scoped operand, or an OR whose operands are all scoped. NOT never scopes: the negation
 * of a tenant filter selects every other tenant. A tenantId comparison against any other
 * tenant anywhere in the tree is a violation even if the filter is otherwise scoped.
 */
@Component
@Slf4j
public class TenantScopeGuard {

    public void check(DataAccess access) {
        String tenantId = access.getCallerTenantId();
        if (tenantId == null || tenantId.isBlank()) {
            throw violation(access, "caller tenant is missing");
        }

        if (access.getOperation().writesPayload()) {
            checkPayloads(access, tenantId);
        }

        if (access.getOperation().needsFilter()) {
            ScopeFilter filter = access.getFilter();
            if (filter == null) {
                throw violation(access, "no filter");
            }
            if (referencesForeignTenant(filter, tenantId)) {
                throw violation(access, "filter references another tenant");
            }
            if (!isScoped(filter, tenantId)) {
                throw violation(access, "filter does not restrict tenantId");
            }
        }
    }

    boolean isScoped(ScopeFilter filter, String tenantId) {
        if (filter instanceof ScopeFilter.FieldEquals) {
            ScopeFilter.FieldEquals eq = (ScopeFilter.FieldEquals) filter;
            return TenantOwned.TENANT_FIELD.equals(eq.getField()) && tenantId.equals(eq.getValue());
        }
        if (filter instanceof ScopeFilter.And) {
            ScopeFilter.And and = (ScopeFilter.And) filter;
            return and.getFilters().stream().anyMatch(child -> isScoped(child, tenantId));
        }
        if (filter instanceof ScopeFilter.Or) {
            ScopeFilter.Or or = (ScopeFilter.Or) filter;
            return !or.getFilters().isEmpty()
                    && or.getFilters().stream().allMatch(child -> isScoped(child, tenantId));
        }
        return false;
    }

    private boolean referencesForeignTenant(ScopeFilter filter, String tenantId) {
        if (filter instanceof ScopeFilter.FieldEquals) {
            ScopeFilter.FieldEquals eq = (ScopeFilter.FieldEquals) filter;
            return TenantOwned.TENANT_FIELD.equals(eq.getField()) && !tenantId.equals(eq.getValue());
        }
        if (filter instanceof ScopeFilter.FieldIsNull) {
            ScopeFilter.FieldIsNull isNull = (ScopeFilter.FieldIsNull) filter;
            return TenantOwned.TENANT_FIELD.equals(isNull.getField());
        }
        if (filter instanceof ScopeFilter.InstantRange) {
            ScopeFilter.InstantRange range = (ScopeFilter.InstantRange) filter;
            return TenantOwned.TENANT_FIELD.equals(range.getField());
        }
        if (filter instanceof ScopeFilter.And) {
            ScopeFilter.And and = (ScopeFilter.And) filter;
            return and.getFilters().stream().anyMatch(child -> referencesForeignTenant(child, tenantId));
        }
        if (filter instanceof ScopeFilter.Or) {
            ScopeFilter.Or or = (ScopeFilter.Or) filter;
            return or.getFilters().stream().anyMatch(child -> referencesForeignTenant(child, tenantId));
        }
        if (filter instanceof ScopeFilter.Not) {
            ScopeFilter.Not not = (ScopeFilter.Not) filter;
            return referencesForeignTenant(not.getFilter(), tenantId);
        }
        return false;
    }

    private void checkPayloads(DataAccess access, String tenantId) {
        List<? extends TenantOwned> payloads = access.getPayloads();
        if (access.getOperation() != DataOperation.CREATE_MANY && payloads.isEmpty()) {
            throw violation(access, "no payload");
        }
        for (TenantOwned payload : payloads) {
            if (payload == null || !Objects.equals(tenantId, payload.getTenantId())) {
                throw violation(access, "payload tenantId does not match caller");
            }
        }
    }

    private TenantScopeViolationException violation(DataAccess access, String detail) {
        log.error("Tenant scope violation: entity={}, operation={}, callerTenant={}, detail={}",
                access.getEntity(), access.getOperation(), access.getCallerTenantId(), detail);
        return new TenantScopeViolationException(access.getEntity(), access.getOperation().name(), detail);
    }
}

package com.psyos.pipeline.repository.scope;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Translates a {@link ScopeFilter} tree into a JPA criteria predicate.
 */
public final class ScopeFilterSpecifications {

    private ScopeFilterSpecifications() {
    }

    public static <T> Specification<T> toSpecification(ScopeFilter filter) {
        return (root, query, cb) -> toPredicate(filter, root, cb);
    }

    private static <T> Predicate toPredicate(ScopeFilter filter, Root<T> root, CriteriaBuilder cb) {
        if (filter instanceof ScopeFilter.FieldEquals) {
            ScopeFilter.FieldEquals eq = (ScopeFilter.FieldEquals) filter;
            return cb.equal(root.get(eq.getField()), eq.getValue());
        }
        if (filter instanceof ScopeFilter.FieldIsNull) {
            ScopeFilter.FieldIsNull isNull = (ScopeFilter.FieldIsNull) filter;
            return cb.isNull(root.get(isNull.getField()));
        }
        if (filter instanceof ScopeFilter.InstantRange) {
            ScopeFilter.InstantRange range = (ScopeFilter.InstantRange) filter;
            Path<Instant> path = root.get(range.getField());
            return cb.and(cb.greaterThanOrEqualTo(path, range.getFrom()), cb.lessThan(path, range.getTo()));
        }
        if (filter instanceof ScopeFilter.And) {
            ScopeFilter.And and = (ScopeFilter.And) filter;
            return cb.and(and.getFilters().stream()
                    .map(child -> toPredicate(child, root, cb))
                    .toArray(Predicate[]::new));
        }
        if (filter instanceof ScopeFilter.Or) {
            ScopeFilter.Or or = (ScopeFilter.Or) filter;
            return cb.or(or.getFilters().stream()
                    .map(child -> toPredicate(child, root, cb))
                    .toArray(Predicate[]::new));
        }
        if (filter instanceof ScopeFilter.Not) {
            ScopeFilter.Not not = (ScopeFilter.Not) filter;
            return cb.not(toPredicate(not.getFilter(), root, cb));
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }
}

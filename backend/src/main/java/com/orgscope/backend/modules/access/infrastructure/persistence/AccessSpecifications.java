package com.orgscope.backend.modules.access.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;

import org.springframework.data.jpa.domain.Specification;

import com.orgscope.backend.modules.access.domain.AccessPredicate;
import com.orgscope.backend.modules.access.domain.CoordinateCondition;
import com.orgscope.backend.modules.access.domain.CoordinateMapping;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Translates {@link AccessPredicate} into JPA criteria.
 */
public final class AccessSpecifications {

    private AccessSpecifications() {
    }

    /**
     * Restricts {@code callerFilter} to the rows {@code predicate} makes visible. The caller filter is
     * AND-ed in and can only narrow the result; it may be null.
     */
    public static <T> Specification<T> restrict(AccessPredicate predicate, CoordinateMapping mapping,
            Specification<T> callerFilter) {
        Specification<T> authorization = toSpecification(predicate, mapping);
        return callerFilter == null ? authorization : authorization.and(callerFilter);
    }

    public static <T> Specification<T> toSpecification(AccessPredicate predicate, CoordinateMapping mapping) {
        return (root, query, cb) -> {
            if (predicate.isUnrestricted()) {
                return cb.conjunction();
            }
            List<Predicate> clauses = new ArrayList<>();
            for (List<CoordinateCondition> clause : predicate.clauses()) {
                List<Predicate> conditions = new ArrayList<>();
                for (CoordinateCondition condition : clause) {
                    conditions.add(toPredicate(condition, mapping, root, cb));
                }
                clauses.add(cb.and(conditions.toArray(Predicate[]::new)));
            }
            if (clauses.isEmpty()) {
                return cb.disjunction();
            }
            return cb.or(clauses.toArray(Predicate[]::new));
        };
    }

    private static Predicate toPredicate(CoordinateCondition condition, CoordinateMapping mapping, Root<?> root,
            CriteriaBuilder cb) {
        String attribute = mapping.attributeFor(condition.field());
        if (attribute == null) {
            // an entity without the field behaves as if the field were always null
            return condition.operator() == CoordinateCondition.Operator.IS_NULL ? cb.conjunction() : cb.disjunction();
        }
        return switch (condition.operator()) {
            case IN -> condition.values().isEmpty()
                    ? cb.disjunction()
                    : root.get(attribute).in(condition.values());
            case IS_NULL -> root.get(attribute).isNull();
            case NOT_NULL -> root.get(attribute).isNotNull();
        };
    }
}

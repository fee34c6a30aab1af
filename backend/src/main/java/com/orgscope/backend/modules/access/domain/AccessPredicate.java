package com.orgscope.backend.modules.access.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

/**
 * Row-level visibility rule in disjunctive normal form: a row is visible when every condition of at
 * least one clause holds. Two special forms exist, {@link #unrestricted()} (always true) and
 * {@link #none()} (always false).
 *
 * <p>Composition is by conjunction only. {@link #or(Predicate)} and {@link #negate()} are rejected
 * because either could widen visibility past what was authorized.</p>
 */
public final class AccessPredicate implements Predicate<OrgCoordinates> {

    private static final AccessPredicate UNRESTRICTED = new AccessPredicate(true, List.of());
    private static final AccessPredicate NONE = new AccessPredicate(false, List.of());

    private final boolean unrestricted;
    private final List<List<CoordinateCondition>> clauses;

    private AccessPredicate(boolean unrestricted, List<List<CoordinateCondition>> clauses) {
        this.unrestricted = unrestricted;
        this.clauses = clauses;
    }

    public static AccessPredicate unrestricted() {
        return UNRESTRICTED;
    }

    public static AccessPredicate none() {
        return NONE;
    }

    public static AccessPredicate anyOf(List<List<CoordinateCondition>> clauses) {
        List<List<CoordinateCondition>> copy = new ArrayList<>();
        for (List<CoordinateCondition> clause : clauses) {
            if (!clause.isEmpty()) {
                copy.add(List.copyOf(clause));
            }
        }
        return copy.isEmpty() ? NONE : new AccessPredicate(false, List.copyOf(copy));
    }

    public static AccessPredicate allOf(CoordinateCondition... conditions) {
        return anyOf(List.of(List.of(conditions)));
    }

    public boolean isUnrestricted() {
        return unrestricted;
    }

    public boolean isNone() {
        return !unrestricted && clauses.isEmpty();
    }

    public List<List<CoordinateCondition>> clauses() {
        return clauses;
    }

    @Override
    public boolean test(OrgCoordinates coordinates) {
        if (unrestricted) {
            return true;
        }
        for (List<CoordinateCondition> clause : clauses) {
            if (clause.stream().allMatch(condition -> condition.test(coordinates))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Conjunction of both predicates, distributed back into clause form.
     */
    public AccessPredicate and(AccessPredicate other) {
        if (unrestricted) {
            return other;
        }
        if (other.unrestricted) {
            return this;
        }
        List<List<CoordinateCondition>> combined = new ArrayList<>();
        for (List<CoordinateCondition> left : clauses) {
            for (List<CoordinateCondition> right : other.clauses) {
                List<CoordinateCondition> clause = new ArrayList<>(left);
                clause.addAll(right);
                combined.add(clause);
            }
        }
        return anyOf(combined);
    }

    @Override
    public Predicate<OrgCoordinates> or(Predicate<? super OrgCoordinates> other) {
        throw new UnsupportedOperationException("Access predicates compose by conjunction only");
    }

    @Override
    public Predicate<OrgCoordinates> negate() {
        throw new UnsupportedOperationException("Access predicates compose by conjunction only");
    }

    @Override
    public String toString() {
        if (unrestricted) {
            return "AccessPredicate[unrestricted]";
        }
        return "AccessPredicate" + clauses;
    }
}

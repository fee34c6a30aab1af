package com.orgscope.backend.modules.access.domain;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

/**
 * A single test on one coordinate field.
 */
public record CoordinateCondition(CoordinateField field, Operator operator, Set<Long> values) {

    public enum Operator {
        IN,
        IS_NULL,
        NOT_NULL
    }

    public CoordinateCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        values = values == null ? Set.of() : Set.copyOf(values);
    }

    public static CoordinateCondition in(CoordinateField field, Collection<Long> values) {
        return new CoordinateCondition(field, Operator.IN, new TreeSet<>(values));
    }

    public static CoordinateCondition in(CoordinateField field, Long value) {
        return new CoordinateCondition(field, Operator.IN, Set.of(value));
    }

    public static CoordinateCondition isNull(CoordinateField field) {
        return new CoordinateCondition(field, Operator.IS_NULL, Set.of());
    }

    public static CoordinateCondition notNull(CoordinateField field) {
        return new CoordinateCondition(field, Operator.NOT_NULL, Set.of());
    }

    public boolean test(OrgCoordinates coordinates) {
        Long value = field.valueIn(coordinates);
        return switch (operator) {
            case IN -> value != null && values.contains(value);
            case IS_NULL -> value == null;
            case NOT_NULL -> value != null;
        };
    }
}

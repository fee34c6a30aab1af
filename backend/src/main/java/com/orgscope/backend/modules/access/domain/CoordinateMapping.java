package com.orgscope.backend.modules.access.domain;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps coordinate fields to the JPA attribute names of one entity. Fields the entity does not carry
 * are left unmapped.
 */
public final class CoordinateMapping {

    private final Map<CoordinateField, String> attributes;

    private CoordinateMapping(Map<CoordinateField, String> attributes) {
        this.attributes = attributes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The attribute for {@code field}, or null when the entity has none.
     */
    public String attributeFor(CoordinateField field) {
        return attributes.get(field);
    }

    public static final class Builder {

        private final Map<CoordinateField, String> attributes = new EnumMap<>(CoordinateField.class);

        private Builder() {
        }

        public Builder map(CoordinateField field, String attribute) {
            attributes.put(field, attribute);
            return this;
        }

        public CoordinateMapping build() {
            return new CoordinateMapping(new EnumMap<>(attributes));
        }
    }
}

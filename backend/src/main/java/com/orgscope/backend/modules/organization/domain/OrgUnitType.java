package com.orgscope.backend.modules.organization.domain;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Levels of the organizational tree, outermost first. Also the closed set of scope types.
 */
public enum OrgUnitType {
    BUSINESS_GROUP("business_group"),
    COMPANY("company"),
    BRANCH("branch"),
    DEPARTMENT("department");

    private final String tag;

    OrgUnitType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static OrgUnitType fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Organization unit type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown organization unit type: " + value));
    }
}

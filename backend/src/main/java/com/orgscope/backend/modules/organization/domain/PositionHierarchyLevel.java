package com.orgscope.backend.modules.organization.domain;

/**
 * General seniority band of a position. Lower weights sort first in org charts.
 */
public enum PositionHierarchyLevel {
    C_LEVEL(5),
    DIRECTOR(15),
    MANAGER(30),
    COORDINATOR(45),
    SPECIALIST(55),
    SENIOR(65),
    INTERMEDIATE(75),
    JUNIOR(85),
    TRAINEE(95);

    private final int defaultWeight;

    PositionHierarchyLevel(int defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public int defaultWeight() {
        return defaultWeight;
    }
}

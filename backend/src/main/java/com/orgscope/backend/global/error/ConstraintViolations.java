package com.orgscope.backend.global.error;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;

public final class ConstraintViolations {

    private ConstraintViolations() {
    }

    /**
     * Whether the root cause of {@code ex} names the given database constraint.
     */
    public static boolean isViolationOf(DataIntegrityViolationException ex, String constraintName) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(constraintName);
    }
}

package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Locale;

import org.springframework.data.jpa.domain.Specification;

import com.orgscope.backend.modules.access.domain.CoordinateField;
import com.orgscope.backend.modules.access.domain.CoordinateMapping;

/**
 * Coordinate mappings for the access filter and the search filters callers combine with it.
 */
public final class OrgSpecifications {

    public static final CoordinateMapping BUSINESS_GROUP_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "id")
            .build();

    public static final CoordinateMapping COMPANY_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "businessGroupId")
            .map(CoordinateField.COMPANY, "id")
            .build();

    public static final CoordinateMapping BRANCH_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "businessGroupId")
            .map(CoordinateField.COMPANY, "companyId")
            .map(CoordinateField.BRANCH, "id")
            .build();

    public static final CoordinateMapping DEPARTMENT_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "businessGroupId")
            .map(CoordinateField.COMPANY, "companyId")
            .map(CoordinateField.BRANCH, "branchId")
            .map(CoordinateField.DEPARTMENT, "id")
            .build();

    public static final CoordinateMapping POSITION_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "businessGroupId")
            .map(CoordinateField.COMPANY, "companyId")
            .build();

    private OrgSpecifications() {
    }

    public static <T> Specification<T> activeOnly(boolean includeInactive) {
        return (root, query, cb) -> includeInactive ? cb.conjunction() : cb.isTrue(root.get("active"));
    }

    public static <T> Specification<T> attributeEquals(String attribute, Object value) {
        return (root, query, cb) -> value == null ? cb.conjunction() : cb.equal(root.get(attribute), value);
    }

    /**
     * Case-insensitive match on name or code.
     */
    public static <T> Specification<T> keyword(String keyword) {
        return (root, query, cb) -> {
            if (keyword == null || keyword.isBlank()) {
                return cb.conjunction();
            }
            String pattern = "%" + keyword.trim().toLowerCase(Locale.ROOT) + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("name")), pattern),
                    cb.like(cb.lower(root.get("code")), pattern));
        };
    }

    public static <T> Specification<T> titleContains(String keyword) {
        return (root, query, cb) -> keyword == null || keyword.isBlank()
                ? cb.conjunction()
                : cb.like(cb.lower(root.get("title")), "%" + keyword.trim().toLowerCase(Locale.ROOT) + "%");
    }
}

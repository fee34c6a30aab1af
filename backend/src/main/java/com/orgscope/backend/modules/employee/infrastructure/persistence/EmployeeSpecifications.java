package com.orgscope.backend.modules.employee.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.data.jpa.domain.Specification;

import com.orgscope.backend.modules.access.domain.CoordinateField;
import com.orgscope.backend.modules.access.domain.CoordinateMapping;
import com.orgscope.backend.modules.employee.domain.Employee;

import jakarta.persistence.criteria.Predicate;

public final class EmployeeSpecifications {

    public static final CoordinateMapping ACCESS_MAPPING = CoordinateMapping.builder()
            .map(CoordinateField.BUSINESS_GROUP, "businessGroupId")
            .map(CoordinateField.COMPANY, "companyId")
            .map(CoordinateField.BRANCH, "branchId")
            .map(CoordinateField.DEPARTMENT, "departmentId")
            .map(CoordinateField.OWNER_USER_ID, "userId")
            .build();

    private EmployeeSpecifications() {
    }

    public static Specification<Employee> search(Long companyId, Long departmentId, String keyword,
            boolean includeInactive) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (companyId != null) {
                predicates.add(cb.equal(root.get("companyId"), companyId));
            }
            if (departmentId != null) {
                predicates.add(cb.equal(root.get("departmentId"), departmentId));
            }
            if (keyword != null && !keyword.isBlank()) {
                String pattern = "%" + keyword.trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("fullName")), pattern),
                        cb.like(cb.lower(root.get("employeeCode")), pattern)));
            }
            if (!includeInactive) {
                predicates.add(cb.isTrue(root.get("active")));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }
}

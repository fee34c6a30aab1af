package com.orgscope.backend.modules.hierarchy.infrastructure;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyLedger;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.organization.domain.Department;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;

@Component
public class DepartmentHierarchyLedger implements HierarchyLedger {

    private final DepartmentRepository departmentRepository;

    public DepartmentHierarchyLedger(DepartmentRepository departmentRepository) {
        this.departmentRepository = departmentRepository;
    }

    @Override
    public HierarchyKind kind() {
        return HierarchyKind.DEPARTMENT;
    }

    @Override
    public Optional<HierarchyNode> findNode(long id) {
        return departmentRepository.findById(id).map(DepartmentHierarchyLedger::toNode);
    }

    @Override
    public List<Long> findChildIds(long parentId) {
        return departmentRepository.findChildIds(parentId);
    }

    @Override
    public boolean hasActiveChildren(long parentId) {
        return departmentRepository.existsByParentIdAndActiveTrue(parentId);
    }

    @Override
    public Optional<HierarchyNode> lockNode(long id) {
        return departmentRepository.findByIdForUpdate(id).map(DepartmentHierarchyLedger::toNode);
    }

    static HierarchyNode toNode(Department department) {
        return new HierarchyNode(
                department.getId(),
                department.getParentId(),
                department.getCompanyId(),
                department.getBusinessGroupId(),
                department.isActive());
    }
}

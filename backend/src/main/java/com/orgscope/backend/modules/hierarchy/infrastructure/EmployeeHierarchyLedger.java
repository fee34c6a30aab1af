package com.orgscope.backend.modules.hierarchy.infrastructure;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.employee.domain.Employee;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyLedger;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;

/**
 * Supervisor links read as parent links.
 */
@Component
public class EmployeeHierarchyLedger implements HierarchyLedger {

    private final EmployeeRepository employeeRepository;

    public EmployeeHierarchyLedger(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    @Override
    public HierarchyKind kind() {
        return HierarchyKind.EMPLOYEE;
    }

    @Override
    public Optional<HierarchyNode> findNode(long id) {
        return employeeRepository.findById(id).map(EmployeeHierarchyLedger::toNode);
    }

    @Override
    public List<Long> findChildIds(long parentId) {
        return employeeRepository.findSubordinateIds(parentId);
    }

    @Override
    public boolean hasActiveChildren(long parentId) {
        return employeeRepository.existsBySupervisorIdAndActiveTrue(parentId);
    }

    @Override
    public Optional<HierarchyNode> lockNode(long id) {
        return employeeRepository.findByIdForUpdate(id).map(EmployeeHierarchyLedger::toNode);
    }

    static HierarchyNode toNode(Employee employee) {
        return new HierarchyNode(
                employee.getId(),
                employee.getSupervisorId(),
                employee.getCompanyId(),
                employee.getBusinessGroupId(),
                employee.isActive());
    }
}

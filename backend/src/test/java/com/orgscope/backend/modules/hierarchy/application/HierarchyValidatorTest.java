package com.orgscope.backend.modules.hierarchy.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyCycleException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyDepthExceededException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.TenantMismatchException;
import com.orgscope.backend.support.InMemoryHierarchyLedger;

class HierarchyValidatorTest {

    private InMemoryHierarchyLedger departments;
    private InMemoryHierarchyLedger employees;
    private HierarchyValidator validator;

    @BeforeEach
    void setUp() {
        departments = new InMemoryHierarchyLedger(HierarchyKind.DEPARTMENT);
        employees = new InMemoryHierarchyLedger(HierarchyKind.EMPLOYEE);
        validator = new HierarchyValidator(List.of(departments, employees));
    }

    @Test
    @DisplayName("D2가 D1의 하위일 때 D1을 D2 아래로 옮기면 순환으로 거부된다")
    void rejectsDepartmentCycle() {
        departments.put(1L, null).put(2L, 1L);

        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 1L, 2L))
                .isInstanceOf(HierarchyCycleException.class)
                .extracting("code").isEqualTo(HierarchyCycleException.CODE);
    }

    @Test
    @DisplayName("E1 > E2 > E3 체인에서 E3를 E1 아래로 두는 것은 허용되고 E1을 E3 아래로 두는 것은 거부된다")
    void supervisorChainCycle() {
        employees.put(1L, null).put(2L, 1L).put(3L, 2L);

        assertThatCode(() -> validator.validateEdge(HierarchyKind.EMPLOYEE, 3L, 1L)).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.EMPLOYEE, 1L, 3L))
                .isInstanceOf(HierarchyCycleException.class);
    }

    @Test
    @DisplayName("자기 자신을 상위로 지정할 수 없다")
    void rejectsSelfParent() {
        employees.put(5L, null);

        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.EMPLOYEE, 5L, 5L))
                .isInstanceOf(HierarchyCycleException.class);
    }

    @Test
    @DisplayName("상위를 해제하는 변경은 항상 허용된다")
    void detachingIsAlwaysValid() {
        departments.put(1L, null).put(2L, 1L);

        assertThatCode(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 2L, null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("부서 체인은 루트까지 5단계까지 허용하고 6단계째 연결은 거부한다")
    void departmentDepthLimit() {
        departments.chain(1L, 5L);

        // 6 is the fifth link below the root
        HierarchyNode sixth = HierarchyNode.unsaved(InMemoryHierarchyLedger.COMPANY_ID,
                InMemoryHierarchyLedger.BUSINESS_GROUP_ID);
        assertThatCode(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, sixth, 5L)).doesNotThrowAnyException();

        departments.put(6L, 5L);
        HierarchyNode seventh = HierarchyNode.unsaved(InMemoryHierarchyLedger.COMPANY_ID,
                InMemoryHierarchyLedger.BUSINESS_GROUP_ID);
        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, seventh, 6L))
                .isInstanceOf(HierarchyDepthExceededException.class);
        assertThat(validator.ancestorPath(HierarchyKind.DEPARTMENT, 6L)).hasSize(6);
    }

    @Test
    @DisplayName("하위 트리를 옮길 때는 하위 트리 높이까지 깊이에 포함된다")
    void depthIncludesMovedSubtree() {
        departments.chain(1L, 4L);
        // subtree 20 > 21 > 22, height 2
        departments.put(20L, null).put(21L, 20L).put(22L, 21L);

        assertThatCode(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 20L, 3L)).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 20L, 4L))
                .isInstanceOf(HierarchyDepthExceededException.class);
    }

    @Test
    @DisplayName("직원 상하 관계는 깊이 제한이 없다")
    void employeeDepthIsUnbounded() {
        employees.chain(1L, 30L);
        employees.put(31L, null);

        assertThatCode(() -> validator.validateEdge(HierarchyKind.EMPLOYEE, 31L, 30L)).doesNotThrowAnyException();
        assertThat(validator.ancestorPath(HierarchyKind.EMPLOYEE, 30L)).hasSize(30);
    }

    @Test
    @DisplayName("다른 회사의 노드를 상위로 지정할 수 없다")
    void rejectsCrossTenantParent() {
        departments.put(1L, null, 10L, true).put(2L, null, 11L, true);

        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 2L, 1L))
                .isInstanceOf(TenantMismatchException.class);
    }

    @Test
    @DisplayName("존재하지 않는 상위 노드는 404로 거부된다")
    void missingParentIsNotFound() {
        employees.put(1L, null);

        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.EMPLOYEE, 1L, 99L))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("employee.not_found");
    }

    @Test
    @DisplayName("저장된 체인이 이미 순환하면 경로 계산과 검증 모두 실패한다")
    void corruptedLoopIsDetected() {
        departments.put(1L, 2L).put(2L, 1L).put(3L, null);

        assertThatThrownBy(() -> validator.ancestorPath(HierarchyKind.DEPARTMENT, 1L))
                .isInstanceOf(HierarchyCycleException.class);
        assertThatThrownBy(() -> validator.validateEdge(HierarchyKind.DEPARTMENT, 3L, 1L))
                .isInstanceOf(HierarchyCycleException.class);
    }

    @Test
    @DisplayName("ancestorPath는 자기 자신부터 루트까지 순서대로 반환한다")
    void ancestorPathOrder() {
        departments.chain(1L, 3L);

        assertThat(validator.ancestorPath(HierarchyKind.DEPARTMENT, 3L))
                .extracting(HierarchyNode::id)
                .containsExactly(3L, 2L, 1L);
    }

    @Test
    @DisplayName("하위 노드 순회는 너비 우선이며 여러 번 반복할 수 있다")
    void descendantsAreRestartable() {
        departments.put(1L, null).put(2L, 1L).put(3L, 1L).put(4L, 2L).put(5L, 4L);

        Iterable<Long> descendants = validator.descendants(HierarchyKind.DEPARTMENT, 1L);

        assertThat(descendants).containsExactly(2L, 3L, 4L, 5L);
        List<Long> second = new ArrayList<>();
        descendants.forEach(second::add);
        assertThat(second).containsExactly(2L, 3L, 4L, 5L);
        assertThat(validator.descendants(HierarchyKind.DEPARTMENT, 5L)).isEmpty();
    }

    @Test
    @DisplayName("활성 하위가 남아 있으면 비활성화할 수 없다")
    void deactivationRequiresNoActiveChildren() {
        departments.put(1L, null).put(2L, 1L).put(3L, null).put(4L, 3L, InMemoryHierarchyLedger.COMPANY_ID, false);

        assertThatThrownBy(() -> validator.validateDeactivation(HierarchyKind.DEPARTMENT, 1L))
                .isInstanceOf(ActiveDescendantsException.class);
        assertThatCode(() -> validator.validateDeactivation(HierarchyKind.DEPARTMENT, 3L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("lockEdge는 id 오름차순으로 잠근다")
    void lockEdgeOrdersByIdAscending() {
        employees.put(3L, null).put(8L, null);

        validator.lockEdge(HierarchyKind.EMPLOYEE, 8L, 3L);

        assertThat(employees.lockOrder()).containsExactly(3L, 8L);
    }

    @Test
    @DisplayName("동일 종류의 원장이 두 번 등록되면 기동에 실패한다")
    void duplicateLedgerIsRejected() {
        assertThatThrownBy(() -> new HierarchyValidator(List.of(departments,
                new InMemoryHierarchyLedger(HierarchyKind.DEPARTMENT))))
                .isInstanceOf(IllegalStateException.class);
    }
}

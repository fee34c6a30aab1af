package com.orgscope.backend.modules.access.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

class AccessPredicateTest {

    private static final OrgCoordinates C10_B100 = OrgCoordinates.ofBranch(1L, 10L, 100L);
    private static final OrgCoordinates C10_CORPORATE = OrgCoordinates.ofDepartment(1L, 10L, null, 500L);
    private static final OrgCoordinates C20 = OrgCoordinates.ofCompany(1L, 20L);

    @Test
    @DisplayName("절 중 하나라도 모두 만족하면 통과한다")
    void disjunctionOfConjunctions() {
        AccessPredicate predicate = AccessPredicate.anyOf(List.of(
                List.of(CoordinateCondition.in(CoordinateField.BRANCH, 100L)),
                List.of(CoordinateCondition.in(CoordinateField.COMPANY, 10L),
                        CoordinateCondition.isNull(CoordinateField.BRANCH),
                        CoordinateCondition.notNull(CoordinateField.DEPARTMENT))));

        assertThat(predicate.test(C10_B100)).isTrue();
        assertThat(predicate.test(C10_CORPORATE)).isTrue();
        assertThat(predicate.test(OrgCoordinates.ofCompany(1L, 10L))).isFalse();
        assertThat(predicate.test(C20)).isFalse();
    }

    @Test
    @DisplayName("AND 합성은 어느 쪽보다도 넓어지지 않는다")
    void conjunctionNeverWidens() {
        AccessPredicate company10 = AccessPredicate.allOf(CoordinateCondition.in(CoordinateField.COMPANY, 10L));
        AccessPredicate branch100 = AccessPredicate.allOf(CoordinateCondition.in(CoordinateField.BRANCH, 100L));
        AccessPredicate combined = company10.and(branch100);

        for (OrgCoordinates target : List.of(C10_B100, C10_CORPORATE, C20)) {
            if (combined.test(target)) {
                assertThat(company10.test(target)).isTrue();
                assertThat(branch100.test(target)).isTrue();
            }
        }
        assertThat(combined.test(C10_B100)).isTrue();
        assertThat(combined.test(C10_CORPORATE)).isFalse();
    }

    @Test
    @DisplayName("무제한과 빈 필터는 AND 합성의 항등원과 흡수원이다")
    void specialFormsUnderConjunction() {
        AccessPredicate company10 = AccessPredicate.allOf(CoordinateCondition.in(CoordinateField.COMPANY, 10L));

        assertThat(AccessPredicate.unrestricted().and(company10)).isSameAs(company10);
        assertThat(company10.and(AccessPredicate.unrestricted())).isSameAs(company10);
        assertThat(company10.and(AccessPredicate.none()).isNone()).isTrue();
        assertThat(AccessPredicate.none().test(C20)).isFalse();
        assertThat(AccessPredicate.unrestricted().test(C20)).isTrue();
    }

    @Test
    @DisplayName("빈 절만 있으면 빈 필터가 된다")
    void emptyClausesCollapseToNone() {
        assertThat(AccessPredicate.anyOf(List.of(List.of())).isNone()).isTrue();
        assertThat(AccessPredicate.anyOf(List.of()).isNone()).isTrue();
    }

    @Test
    @DisplayName("OR와 부정은 지원하지 않는다")
    void wideningOperationsAreRejected() {
        AccessPredicate predicate = AccessPredicate.allOf(CoordinateCondition.in(CoordinateField.COMPANY, 10L));

        assertThatThrownBy(() -> predicate.or(coordinates -> true))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(predicate::negate).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("값이 없는 좌표는 IN 조건을 만족하지 않는다")
    void nullCoordinateNeverMatchesIn() {
        CoordinateCondition condition = CoordinateCondition.in(CoordinateField.BRANCH, 100L);

        assertThat(condition.test(OrgCoordinates.ofCompany(1L, 10L))).isFalse();
    }
}

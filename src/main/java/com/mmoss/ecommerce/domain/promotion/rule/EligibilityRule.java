package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.Optional;

/**
 * EligibilityRule - 프로모션 자격 조건
 *
 * 구현체:
 * - UnrestrictedRule: 조건 없음
 * - FulfilmentRestrictedRule: 특정 수령 방식만
 * - FirstPickupOrderRule: 첫 픽업 주문만
 * - StaffOnlyRule: 교직원 계정만
 * - AllOfRule: 여러 조건 모두 충족
 */
public interface EligibilityRule {

    /**
     * @return 부적격이면 사유, 적격이면 빈 값
     */
    Optional<String> rejectionReason(EligibilityContext context);

    /**
     * 화면 표시용 조건 설명
     */
    String describe();

    default boolean isSatisfiedBy(EligibilityContext context) {
        return rejectionReason(context).isEmpty();
    }
}

package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.Optional;

/**
 * 교직원 계정(학생이 아니고 교직원 이메일 도메인)에만 적용
 */
public final class StaffOnlyRule implements EligibilityRule {

    @Override
    public Optional<String> rejectionReason(EligibilityContext context) {
        if (context.getCustomer() == null || !context.getCustomer().isStaff(context.getStaffEmailDomain())) {
            return Optional.of("Only valid for staff accounts");
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "Staff accounts only";
    }
}

package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.Objects;
import java.util.Optional;

/**
 * 지정된 수령 방식의 주문에만 적용
 */
public final class FulfilmentRestrictedRule implements EligibilityRule {

    private final FulfilmentMode allowed;

    public FulfilmentRestrictedRule(FulfilmentMode allowed) {
        this.allowed = Objects.requireNonNull(allowed, "allowed는 null이 될 수 없습니다");
    }

    @Override
    public Optional<String> rejectionReason(EligibilityContext context) {
        if (context.getFulfilment() != allowed) {
            return Optional.of("Only valid for " + allowed.getDisplayName().toLowerCase() + " orders");
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return allowed.getDisplayName() + " only";
    }
}

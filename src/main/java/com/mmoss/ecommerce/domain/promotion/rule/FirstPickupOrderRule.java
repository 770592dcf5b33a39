package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.Optional;

/**
 * 픽업 주문 이력이 없는 고객의 픽업 주문에만 적용
 */
public final class FirstPickupOrderRule implements EligibilityRule {

    @Override
    public Optional<String> rejectionReason(EligibilityContext context) {
        if (context.getFulfilment() != FulfilmentMode.PICKUP) {
            return Optional.of("Only valid for store pickup orders");
        }
        if (context.isPreviousPickupOrder()) {
            return Optional.of("Only valid on your first pickup order");
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "First store pickup order only";
    }
}

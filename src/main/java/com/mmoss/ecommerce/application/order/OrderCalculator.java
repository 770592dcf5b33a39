package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.promotion.Promotion;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OrderCalculator - 결제 금액 계산 전담
 *
 * 책임:
 * - 소계 계산 (항목 스냅샷 단가 × 수량)
 * - 학생 픽업 할인 계산
 * - 배송비 계산
 * - 프로모션 할인 계산
 * - 최종 결제액 계산
 *
 * 설계 원칙:
 * - 순수한 계산 로직만 포함 (부수 효과 없음)
 * - 금액 정책 값은 ShopPolicy에서 주입
 *
 * 계산식:
 * - 학생 할인 = 학생 + 픽업일 때만 소계 × 5%
 * - 배송비 = 배송 $20 (학생 면제), 픽업 $0
 * - 최종금액 = 소계 - 학생 할인 - 프로모션 할인 + 배송비 (최소 0)
 */
@Component
public class OrderCalculator {

    private final ShopPolicy shopPolicy;

    public OrderCalculator(ShopPolicy shopPolicy) {
        this.shopPolicy = shopPolicy;
    }

    /**
     * 소계 = Σ(항목 단가 × 수량)
     */
    public Money calculateSubtotal(List<OrderLine> lines) {
        Money subtotal = Money.ZERO;
        for (OrderLine line : lines) {
            subtotal = subtotal.add(line.getLineTotal());
        }
        return subtotal;
    }

    public boolean isStudentPickupDiscountApplicable(User customer, FulfilmentMode fulfilment) {
        return customer.isStudent() && fulfilment == FulfilmentMode.PICKUP;
    }

    public Money calculateStudentDiscount(Money subtotal, User customer, FulfilmentMode fulfilment) {
        if (!isStudentPickupDiscountApplicable(customer, fulfilment)) {
            return Money.ZERO;
        }
        return subtotal.percentage(shopPolicy.getStudentPickupDiscountPercent());
    }

    public Money calculateDeliveryFee(User customer, FulfilmentMode fulfilment) {
        if (fulfilment != FulfilmentMode.DELIVERY || customer.isStudent()) {
            return Money.ZERO;
        }
        return shopPolicy.getDeliveryFee();
    }

    /**
     * @param promotion 적용할 프로모션 (null이면 0)
     */
    public Money calculatePromoDiscount(Money subtotal, Promotion promotion) {
        return promotion == null ? Money.ZERO : promotion.discountFor(subtotal);
    }

    /**
     * 최종 결제액 (음수 방지: 최소값 0)
     */
    public Money calculateTotal(Money subtotal, Money studentDiscount, Money promoDiscount, Money deliveryFee) {
        return Order.computeTotal(subtotal, studentDiscount, promoDiscount, deliveryFee);
    }
}

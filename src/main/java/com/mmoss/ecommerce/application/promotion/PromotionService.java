package com.mmoss.ecommerce.application.promotion;

import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.OrderRepository;
import com.mmoss.ecommerce.domain.promotion.EligibilityContext;
import com.mmoss.ecommerce.domain.promotion.InvalidPromoException;
import com.mmoss.ecommerce.domain.promotion.Promotion;
import com.mmoss.ecommerce.domain.promotion.PromotionCatalog;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * PromotionService - 프로모션 조회 및 자격 판정 (Application 계층)
 *
 * 책임:
 * - 전체 프로모션 목록 제공
 * - 고객/수령 방식별 적용 가능 프로모션 목록 제공
 * - 결제 시 프로모션 코드 검증
 *
 * 핵심 비즈니스 규칙:
 * - 학생 픽업 할인이 적용되는 주문에는 어떤 프로모션도 적용하지 않음
 * - 첫 픽업 주문 여부는 주문 로그로 판정
 */
@Service
public class PromotionService {

    private final PromotionCatalog promotionCatalog;
    private final OrderRepository orderRepository;
    private final ShopPolicy shopPolicy;

    public PromotionService(PromotionCatalog promotionCatalog,
                            OrderRepository orderRepository,
                            ShopPolicy shopPolicy) {
        this.promotionCatalog = promotionCatalog;
        this.orderRepository = orderRepository;
        this.shopPolicy = shopPolicy;
    }

    public List<Promotion> listAll() {
        return promotionCatalog.all();
    }

    /**
     * 고객이 해당 수령 방식으로 주문할 때 적용 가능한 프로모션
     */
    public List<Promotion> eligibleFor(User customer, FulfilmentMode fulfilment) {
        boolean studentPickup = customer.isStudent() && fulfilment == FulfilmentMode.PICKUP;
        return promotionCatalog.eligibleFor(buildContext(customer, fulfilment, studentPickup));
    }

    /**
     * 결제용 프로모션 코드 검증
     *
     * @throws InvalidPromoException 존재하지 않는 코드, 자격 미충족, 학생 픽업 할인과 중복
     */
    public Promotion resolveForCheckout(String code, User customer, FulfilmentMode fulfilment,
                                        boolean studentPickupDiscount) {
        Promotion promotion = promotionCatalog.resolve(code);
        promotion.checkEligibility(buildContext(customer, fulfilment, studentPickupDiscount));
        return promotion;
    }

    private EligibilityContext buildContext(User customer, FulfilmentMode fulfilment, boolean studentPickupDiscount) {
        return EligibilityContext.builder()
                .customer(customer)
                .fulfilment(fulfilment)
                .previousPickupOrder(orderRepository.hasPickupOrder(customer.getEmail()))
                .studentPickupDiscount(studentPickupDiscount)
                .staffEmailDomain(shopPolicy.getStaffEmailDomain())
                .build();
    }
}

package com.mmoss.ecommerce.domain.promotion;

import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.user.User;
import lombok.Builder;
import lombok.Getter;

/**
 * 프로모션 자격 판정에 필요한 주문 상황
 */
@Getter
@Builder
public class EligibilityContext {

    private final User customer;
    private final FulfilmentMode fulfilment;

    /** 고객의 과거 픽업 주문 존재 여부 */
    private final boolean previousPickupOrder;

    /** 이번 주문에 학생 픽업 할인이 적용되는지 여부 */
    private final boolean studentPickupDiscount;

    private final String staffEmailDomain;
}

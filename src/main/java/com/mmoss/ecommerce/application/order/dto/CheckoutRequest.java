package com.mmoss.ecommerce.application.order.dto;

import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import lombok.Builder;
import lombok.Getter;

/**
 * 결제 요청 (수령 방식, 배송지 또는 픽업 매장, 프로모션 코드)
 */
@Getter
@Builder
public class CheckoutRequest {

    private final FulfilmentMode fulfilment;
    private final String deliveryAddress;
    private final String storeId;
    private final String promoCode;

    public boolean hasPromoCode() {
        return promoCode != null && !promoCode.isBlank();
    }

    public boolean hasStoreId() {
        return storeId != null && !storeId.isBlank();
    }
}

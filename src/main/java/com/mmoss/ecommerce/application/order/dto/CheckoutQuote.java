package com.mmoss.ecommerce.application.order.dto;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.store.PickupStore;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * CheckoutQuote - 결제 견적 (확정 전 가격 내역)
 *
 * promoNotice는 프로모션 코드가 거부된 경우의 안내 메시지이며,
 * 이 경우 appliedPromoCode는 null이고 promoDiscount는 0이다.
 */
@Getter
@Builder
public class CheckoutQuote {

    private final String customerEmail;
    private final FulfilmentMode fulfilment;
    private final String deliveryAddress;
    private final PickupStore pickupStore;
    private final boolean vipPricing;
    private final List<OrderLine> lines;
    private final Money subtotal;
    private final Money studentDiscount;
    private final Money promoDiscount;
    private final Money deliveryFee;
    private final Money total;
    private final String appliedPromoCode;
    private final String promoNotice;
    private final Money fundsAvailable;

    public boolean hasPromoNotice() {
        return promoNotice != null;
    }

    public String getStoreId() {
        return pickupStore == null ? null : pickupStore.getStoreId();
    }

    public Money getFundsAfterPayment() {
        return fundsAvailable.subtractOrZero(total);
    }
}

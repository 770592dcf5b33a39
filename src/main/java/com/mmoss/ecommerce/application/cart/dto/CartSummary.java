package com.mmoss.ecommerce.application.cart.dto;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * CartSummary - 장바구니 요약
 *
 * 정가/VIP 기준 소계를 모두 보여 주어 VIP 절감액을 안내한다.
 */
@Getter
@Builder
public class CartSummary {

    private final List<CartLineView> lines;
    private final int lineCount;
    private final int totalUnits;
    private final int remainingUnits;
    private final Money regularSubtotal;
    private final Money memberSubtotal;
    private final boolean vipActive;

    public Money getVipSavings() {
        return regularSubtotal.subtractOrZero(memberSubtotal);
    }

    public Money getPayableSubtotal() {
        return vipActive ? memberSubtotal : regularSubtotal;
    }
}

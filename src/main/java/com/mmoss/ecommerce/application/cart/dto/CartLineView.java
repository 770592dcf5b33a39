package com.mmoss.ecommerce.application.cart.dto;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

/**
 * 장바구니 화면용 항목 정보 (상품이 삭제된 경우 available=false, 가격 0)
 */
@Getter
@Builder
public class CartLineView {

    private final String sku;
    private final String name;
    private final int quantity;
    private final Money unitPrice;
    private final Money memberPrice;
    private final Money lineTotal;
    private final Money memberLineTotal;
    private final int stock;
    private final boolean available;

    public boolean exceedsStock() {
        return !available || quantity > stock;
    }
}

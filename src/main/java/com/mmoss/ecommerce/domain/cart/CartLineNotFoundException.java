package com.mmoss.ecommerce.domain.cart;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 장바구니에 없는 SKU를 수정/삭제하려 할 때 발생
 */
@Getter
public class CartLineNotFoundException extends DomainException {

    private final String sku;

    public CartLineNotFoundException(String sku) {
        super(ErrorCode.CART_LINE_NOT_FOUND, "SKU " + sku);
        this.sku = sku;
    }
}

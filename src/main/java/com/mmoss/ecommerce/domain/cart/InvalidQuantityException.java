package com.mmoss.ecommerce.domain.cart;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 장바구니 수량이 허용 범위(1~10)를 벗어날 때 발생
 */
@Getter
public class InvalidQuantityException extends DomainException {

    private final int quantity;

    public InvalidQuantityException(int quantity) {
        super(ErrorCode.CART_INVALID_QUANTITY, CartConstants.MSG_INVALID_LINE_QUANTITY + " (got " + quantity + ")");
        this.quantity = quantity;
    }
}

package com.mmoss.ecommerce.domain.cart;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 빈 장바구니로 결제를 시도할 때 발생
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException() {
        super(ErrorCode.EMPTY_CART);
    }
}

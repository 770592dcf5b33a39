package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 주문 ID로 주문을 찾을 수 없거나 다른 고객의 주문일 때 발생
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, orderId);
    }
}

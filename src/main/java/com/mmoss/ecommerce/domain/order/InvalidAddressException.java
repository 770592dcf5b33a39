package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 배송 주문에 배송지가 없을 때 발생
 */
public class InvalidAddressException extends DomainException {

    public InvalidAddressException() {
        super(ErrorCode.INVALID_ADDRESS);
    }
}

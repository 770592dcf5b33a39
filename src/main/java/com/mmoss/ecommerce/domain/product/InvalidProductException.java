package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 관리자 입력이 상품 규칙(가격, 회원가, 재고, 필수 필드)을 위반할 때 발생
 */
public class InvalidProductException extends DomainException {

    public InvalidProductException(String reason) {
        super(ErrorCode.INVALID_PRODUCT, reason);
    }
}

package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 이미 존재하는 SKU로 상품을 추가하려 할 때 발생
 */
@Getter
public class DuplicateProductException extends DomainException {

    private final String sku;

    public DuplicateProductException(String sku) {
        super(ErrorCode.DUPLICATE_PRODUCT, "SKU " + sku);
        this.sku = sku;
    }
}

package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * ProductNotFoundException - SKU로 상품을 찾을 수 없을 때 발생
 *
 * 호출 예시:
 * - 장바구니 추가 시 존재하지 않는 SKU
 * - 결제 시 장바구니에 담긴 뒤 삭제된 상품
 * - 관리자 수정/삭제 대상 없음
 */
@Getter
public class ProductNotFoundException extends DomainException {

    private final String sku;

    public ProductNotFoundException(String sku) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "SKU " + sku);
        this.sku = sku;
    }
}

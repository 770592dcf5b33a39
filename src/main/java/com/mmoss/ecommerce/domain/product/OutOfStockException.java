package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * OutOfStockException - 요청 수량이 현재 재고를 초과할 때 발생
 *
 * 결제 견적과 확정 시점 모두 실시간 재고 기준으로 검증한다.
 */
@Getter
public class OutOfStockException extends DomainException {

    private final String sku;
    private final int requested;
    private final int available;

    public OutOfStockException(String sku, int requested, int available) {
        super(ErrorCode.OUT_OF_STOCK,
                String.format("SKU %s: requested %d, available %d", sku, requested, available));
        this.sku = sku;
        this.requested = requested;
        this.available = available;
    }
}

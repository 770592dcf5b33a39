package com.mmoss.ecommerce.domain.store;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 픽업 주문에 존재하지 않는 매장 ID를 지정했을 때 발생
 */
@Getter
public class StoreNotFoundException extends DomainException {

    private final String storeId;

    public StoreNotFoundException(String storeId) {
        super(ErrorCode.STORE_NOT_FOUND, storeId);
        this.storeId = storeId;
    }
}

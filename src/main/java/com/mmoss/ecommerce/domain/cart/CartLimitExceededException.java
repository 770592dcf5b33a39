package com.mmoss.ecommerce.domain.cart;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * CartLimitExceededException - 장바구니 상한 초과
 *
 * 발생 조건:
 * - 한 항목 수량이 10 초과
 * - 전체 수량이 20 초과
 * - 서로 다른 항목이 20개 초과
 */
public class CartLimitExceededException extends DomainException {

    private CartLimitExceededException(String detail) {
        super(ErrorCode.CART_LIMIT_EXCEEDED, detail);
    }

    public static CartLimitExceededException lineQuantity(String sku, int resultingQuantity) {
        return new CartLimitExceededException(String.format(
                "%s would have %d units, the maximum per item is %d",
                sku, resultingQuantity, CartConstants.MAX_LINE_QUANTITY));
    }

    public static CartLimitExceededException totalUnits(int resultingTotal) {
        return new CartLimitExceededException(String.format(
                "cart would hold %d units, the maximum is %d", resultingTotal, CartConstants.MAX_TOTAL_UNITS));
    }

    public static CartLimitExceededException lineCount() {
        return new CartLimitExceededException(String.format(
                "the cart can hold at most %d different items", CartConstants.MAX_LINES));
    }
}

package com.mmoss.ecommerce.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 역할:
 * - 항목 수량, 전체 수량, 항목 수 상한
 *
 * 사용 예:
 * - if (quantity < CartConstants.MIN_LINE_QUANTITY || quantity > CartConstants.MAX_LINE_QUANTITY) throw ...
 */
public class CartConstants {

    // ========== Quantity Limits ==========

    /** 항목 최소 수량 */
    public static final int MIN_LINE_QUANTITY = 1;

    /** 항목 최대 수량 */
    public static final int MAX_LINE_QUANTITY = 10;

    /** 장바구니 전체 수량 상한 */
    public static final int MAX_TOTAL_UNITS = 20;

    /** 장바구니 항목(서로 다른 SKU) 수 상한 */
    public static final int MAX_LINES = 20;

    // ========== Messages ==========

    public static final String MSG_INVALID_LINE_QUANTITY = String.format(
            "Quantity must be between %d and %d", MIN_LINE_QUANTITY, MAX_LINE_QUANTITY);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}

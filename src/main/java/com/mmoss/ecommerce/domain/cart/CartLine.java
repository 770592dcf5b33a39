package com.mmoss.ecommerce.domain.cart;

import lombok.Getter;

/**
 * CartLine - 장바구니 항목
 *
 * 상품은 SKU로만 참조하며 가격은 보관하지 않는다 (결제 시점에 조회).
 */
@Getter
public class CartLine {

    private final String sku;
    private int quantity;

    CartLine(String sku, int quantity) {
        this.sku = sku;
        this.quantity = quantity;
    }

    void changeQuantity(int quantity) {
        this.quantity = quantity;
    }

    @Override
    public String toString() {
        return "CartLine(" + sku + " x" + quantity + ")";
    }
}

package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * OrderLine - 주문 항목 스냅샷
 *
 * 주문 시점의 상품명과 가격을 복사해 두므로
 * 이후 카탈로그 수정/삭제가 과거 주문에 영향을 주지 않는다.
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderLine {

    private final String sku;
    private final String name;
    private final int quantity;
    private final Money regularPrice;
    private final Money memberPrice;
    private final Money unitPrice;
    private final Money lineTotal;

    /**
     * 상품과 VIP 여부로부터 스냅샷 생성
     *
     * @throws IllegalArgumentException quantity <= 0
     */
    public static OrderLine snapshot(Product product, int quantity, boolean vipPricing) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than 0");
        }
        Money unitPrice = product.unitPriceFor(vipPricing);
        return OrderLine.builder()
                .sku(product.getSku())
                .name(product.getName())
                .quantity(quantity)
                .regularPrice(product.getPrice())
                .memberPrice(product.getMemberPrice())
                .unitPrice(unitPrice)
                .lineTotal(unitPrice.multiply(quantity))
                .build();
    }
}

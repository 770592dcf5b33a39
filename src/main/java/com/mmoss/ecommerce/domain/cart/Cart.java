package com.mmoss.ecommerce.domain.cart;

import com.mmoss.ecommerce.domain.product.Product;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cart 도메인 엔티티 (세션 단위, 저장하지 않음)
 *
 * 책임:
 * - SKU별 항목을 추가 순서대로 관리
 * - 항목/전체 수량 상한 검증
 *
 * 핵심 비즈니스 규칙:
 * - 항목 수량: 1~10
 * - 전체 수량: 최대 20
 * - 항목 수: 최대 20
 * - 같은 SKU 추가 시 기존 항목 수량에 합산
 * - 재고는 담을 때가 아니라 결제 시점에 검증
 *
 * 모든 변경은 검증을 통과한 뒤에만 반영된다.
 */
public class Cart {

    private final Map<String, CartLine> lines = new LinkedHashMap<>();

    /**
     * 항목 추가 (기존 항목이면 수량 합산)
     *
     * @throws InvalidQuantityException quantity < 1
     * @throws CartLimitExceededException 항목/전체 수량 또는 항목 수 상한 초과
     */
    public void add(String sku, int quantity) {
        String key = Product.normalizeSku(sku);
        if (quantity < CartConstants.MIN_LINE_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        // 한 번에 담는 수량도 항목 상한 이내 (합산 시 int 범위 보장)
        if (quantity > CartConstants.MAX_LINE_QUANTITY) {
            throw CartLimitExceededException.lineQuantity(key, quantity);
        }
        CartLine existing = lines.get(key);
        int resultingLineQuantity = (existing == null ? 0 : existing.getQuantity()) + quantity;
        if (resultingLineQuantity > CartConstants.MAX_LINE_QUANTITY) {
            throw CartLimitExceededException.lineQuantity(key, resultingLineQuantity);
        }
        int resultingTotal = totalUnits() + quantity;
        if (resultingTotal > CartConstants.MAX_TOTAL_UNITS) {
            throw CartLimitExceededException.totalUnits(resultingTotal);
        }
        if (existing == null && lines.size() >= CartConstants.MAX_LINES) {
            throw CartLimitExceededException.lineCount();
        }

        if (existing == null) {
            lines.put(key, new CartLine(key, quantity));
        } else {
            existing.changeQuantity(resultingLineQuantity);
        }
    }

    /**
     * 항목 수량 변경
     *
     * @throws CartLineNotFoundException 장바구니에 없는 SKU
     * @throws InvalidQuantityException 1~10 범위 밖
     * @throws CartLimitExceededException 전체 수량 상한 초과
     */
    public void updateQuantity(String sku, int quantity) {
        String key = Product.normalizeSku(sku);
        CartLine line = lines.get(key);
        if (line == null) {
            throw new CartLineNotFoundException(key);
        }
        if (quantity < CartConstants.MIN_LINE_QUANTITY || quantity > CartConstants.MAX_LINE_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        int resultingTotal = totalUnits() - line.getQuantity() + quantity;
        if (resultingTotal > CartConstants.MAX_TOTAL_UNITS) {
            throw CartLimitExceededException.totalUnits(resultingTotal);
        }
        line.changeQuantity(quantity);
    }

    /**
     * @throws CartLineNotFoundException 장바구니에 없는 SKU
     */
    public void remove(String sku) {
        String key = Product.normalizeSku(sku);
        if (lines.remove(key) == null) {
            throw new CartLineNotFoundException(key);
        }
    }

    public void clear() {
        lines.clear();
    }

    /**
     * 추가 순서대로 정렬된 항목 목록 (읽기 전용)
     */
    public List<CartLine> list() {
        return Collections.unmodifiableList(new ArrayList<>(lines.values()));
    }

    public boolean contains(String sku) {
        return lines.containsKey(Product.normalizeSku(sku));
    }

    public int quantityOf(String sku) {
        CartLine line = lines.get(Product.normalizeSku(sku));
        return line == null ? 0 : line.getQuantity();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int lineCount() {
        return lines.size();
    }

    public int totalUnits() {
        return lines.values().stream().mapToInt(CartLine::getQuantity).sum();
    }

    public int remainingUnits() {
        return CartConstants.MAX_TOTAL_UNITS - totalUnits();
    }
}

package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 정보 관리 (SKU, 이름, 브랜드, 분류, 가격)
 * - 재고 차감/복원
 * - 식품 상품의 유통기한, 성분, 보관 방법, 알레르기 정보 관리
 *
 * 핵심 비즈니스 규칙:
 * - SKU는 공백 제거 후 대문자로 저장 (대소문자 무시 조회)
 * - 정가는 0보다 커야 함
 * - 회원가는 0보다 크고 정가 이하
 * - 재고는 0 이상
 * - 식품 상품은 유통기한 필수
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    private String sku;
    private String name;
    private String brand;
    private String description;
    private String category;
    private String subcategory;
    private Money price;
    private Money memberPrice;
    private int stock;
    private boolean food;
    private LocalDate expiryDate;
    private String ingredients;
    private String storage;
    private String allergens;

    /**
     * 상품 생성 팩토리 메서드
     *
     * @throws IllegalArgumentException 필수 값 누락 또는 가격/재고 규칙 위반
     */
    public static Product createProduct(String sku, String name, String brand, String description,
                                        String category, String subcategory,
                                        Money price, Money memberPrice, int stock) {
        Product product = Product.builder()
                .sku(normalizeSku(sku))
                .name(trim(name))
                .brand(trim(brand))
                .description(trim(description))
                .category(trim(category))
                .subcategory(trim(subcategory))
                .price(price)
                .memberPrice(memberPrice)
                .stock(stock)
                .build();
        product.validate();
        return product;
    }

    /**
     * 상품 데이터 유효성 검증
     *
     * @throws IllegalArgumentException 규칙 위반 시 (메시지에 위반 내용 포함)
     */
    public void validate() {
        requireText(sku, "SKU is required");
        requireText(name, "Name is required");
        requireText(brand, "Brand is required");
        requireText(category, "Category is required");
        requireText(subcategory, "Subcategory is required");
        if (price == null || !price.isPositive()) {
            throw new IllegalArgumentException("Price must be greater than 0");
        }
        if (memberPrice == null || !memberPrice.isPositive()) {
            throw new IllegalArgumentException("Member price must be greater than 0");
        }
        if (memberPrice.isGreaterThan(price)) {
            throw new IllegalArgumentException("Member price cannot exceed the regular price");
        }
        if (stock < 0) {
            throw new IllegalArgumentException("Stock cannot be negative");
        }
        if (food && expiryDate == null) {
            throw new IllegalArgumentException("Food products need an expiry date");
        }
    }

    // ========== 재고 ==========

    public boolean isInStock() {
        return stock > 0;
    }

    public boolean hasStock(int quantity) {
        return stock >= quantity;
    }

    /**
     * 재고 차감
     *
     * @throws OutOfStockException 요청 수량이 현재 재고보다 많은 경우
     */
    public void deductStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity to deduct must be greater than 0");
        }
        if (stock < quantity) {
            throw new OutOfStockException(sku, quantity, stock);
        }
        this.stock -= quantity;
    }

    /**
     * 재고 복원 (결제 보상 처리 시)
     */
    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity to restore must be greater than 0");
        }
        this.stock += quantity;
    }

    // ========== 가격 ==========

    /**
     * VIP 회원 여부에 따른 단가
     */
    public Money unitPriceFor(boolean vipActive) {
        return vipActive ? memberPrice : price;
    }

    public Money vipSaving() {
        return price.subtract(memberPrice);
    }

    // ========== 식품 정보 ==========

    public boolean isExpired(LocalDate today) {
        return food && expiryDate != null && expiryDate.isBefore(today);
    }

    /**
     * 알레르기 성분 포함 여부 (대소문자 무시 부분 일치)
     */
    public boolean hasAllergen(String allergen) {
        if (allergens == null || allergen == null || allergen.isBlank()) {
            return false;
        }
        String needle = allergen.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(allergens.split("[,;]"))
                .map(a -> a.trim().toLowerCase(Locale.ROOT))
                .anyMatch(a -> a.contains(needle));
    }

    public static String normalizeSku(String sku) {
        return sku == null ? null : sku.trim().toUpperCase(Locale.ROOT);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}

package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.domain.common.vo.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Product 도메인 단위 테스트
 * - 생성 검증 (가격, 재고, 식품 유통기한)
 * - 재고 차감/복원
 * - VIP 가격, 알레르기, 유통기한
 */
@DisplayName("Product 도메인 테스트")
class ProductTest {

    private static Product notebook(int stock) {
        return Product.createProduct("p009", "A4 Notebook", "Campus", "Ruled 96 pages",
                "Stationery", "Paper", Money.of("19.99"), Money.of("17.99"), stock);
    }

    // ========== 생성 ==========

    @Test
    @DisplayName("생성 - SKU는 대문자로 정규화")
    void testCreate_NormalizesSku() {
        Product product = notebook(12);

        assertEquals("P009", product.getSku());
        assertTrue(product.isInStock());
        assertEquals(Money.of("2.00"), product.vipSaving());
    }

    @Test
    @DisplayName("생성 실패 - VIP 가격이 정가보다 높음")
    void testCreate_MemberPriceAboveRegular() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> Product.createProduct("P100", "Pen", "Campus", "", "Stationery", "Writing",
                        Money.of("2.00"), Money.of("2.50"), 5));
        assertEquals("Member price cannot exceed the regular price", exception.getMessage());
    }

    @Test
    @DisplayName("생성 실패 - 가격 0 또는 음수 재고")
    void testCreate_InvalidPriceOrStock() {
        assertThrows(IllegalArgumentException.class,
                () -> Product.createProduct("P100", "Pen", "Campus", "", "Stationery", "Writing",
                        Money.ZERO, Money.ZERO, 5));
        assertThrows(IllegalArgumentException.class,
                () -> Product.createProduct("P100", "Pen", "Campus", "", "Stationery", "Writing",
                        Money.of("2.00"), Money.of("1.50"), -1));
    }

    @Test
    @DisplayName("검증 실패 - 식품인데 유통기한 없음")
    void testValidate_FoodWithoutExpiry() {
        Product milk = notebook(1).toBuilder().food(true).expiryDate(null).build();

        assertThrows(IllegalArgumentException.class, milk::validate);
    }

    // ========== 재고 ==========

    @Test
    @DisplayName("재고 차감 - 성공 후 복원")
    void testDeductAndRestoreStock() {
        Product product = notebook(3);

        product.deductStock(3);
        assertFalse(product.isInStock());

        product.restoreStock(2);
        assertEquals(2, product.getStock());
    }

    @Test
    @DisplayName("재고 차감 실패 - 재고 부족이면 변경 없음")
    void testDeductStock_OutOfStock() {
        Product product = notebook(2);

        OutOfStockException exception = assertThrows(OutOfStockException.class, () -> product.deductStock(3));

        assertEquals("P009", exception.getSku());
        assertEquals(3, exception.getRequested());
        assertEquals(2, exception.getAvailable());
        assertEquals(2, product.getStock());
    }

    // ========== 가격 / 식품 정보 ==========

    @Test
    @DisplayName("단가 - VIP 활성 여부에 따라 선택")
    void testUnitPriceFor() {
        Product product = notebook(1);

        assertEquals(Money.of("17.99"), product.unitPriceFor(true));
        assertEquals(Money.of("19.99"), product.unitPriceFor(false));
    }

    @Test
    @DisplayName("유통기한 경과 - 식품만 판단")
    void testIsExpired() {
        LocalDate today = LocalDate.of(2026, 3, 10);
        Product milk = notebook(1).toBuilder().food(true).expiryDate(today.minusDays(1)).build();
        Product fresh = milk.toBuilder().expiryDate(today).build();

        assertTrue(milk.isExpired(today));
        assertFalse(fresh.isExpired(today));
        assertFalse(notebook(1).isExpired(today));
    }

    @Test
    @DisplayName("알레르기 - 대소문자 무시 부분 일치")
    void testHasAllergen() {
        Product bread = notebook(1).toBuilder().allergens("Wheat, Soy; Sesame").build();

        assertTrue(bread.hasAllergen("soy"));
        assertTrue(bread.hasAllergen("SESAME"));
        assertFalse(bread.hasAllergen("milk"));
        assertFalse(bread.hasAllergen(" "));
    }
}

package com.mmoss.ecommerce.domain.common;

import com.mmoss.ecommerce.domain.common.vo.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Money 값 객체 단위 테스트
 * - 생성과 파싱
 * - 산술 연산 (음수 방지)
 * - 백분율 반올림
 * - 표시 형식
 */
@DisplayName("Money 값 객체 테스트")
class MoneyTest {

    // ========== 생성 ==========

    @Test
    @DisplayName("생성 - 소수 둘째 자리로 반올림")
    void testCreate_ScaledToCents() {
        assertEquals("12.35", Money.of(new BigDecimal("12.345")).toPlainString());
        assertEquals("3.00", Money.of("3").toPlainString());
    }

    @Test
    @DisplayName("생성 - 달러 기호와 천 단위 구분자 허용")
    void testCreate_ParsesFormattedAmount() {
        assertEquals(Money.of("1234.50"), Money.of("$1,234.50"));
    }

    @Test
    @DisplayName("생성 실패 - 음수 또는 숫자가 아닌 값")
    void testCreate_InvalidAmount() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("-0.01"));
        IllegalArgumentException exception =
                assertThrows(IllegalArgumentException.class, () -> Money.of("abc"));
        assertEquals("Not a valid amount: abc", exception.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Money.of(" "));
    }

    // ========== 연산 ==========

    @Test
    @DisplayName("차감 - 결과가 음수이면 예외")
    void testSubtract_NegativeResult() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("1.00").subtract(Money.of("1.01")));
    }

    @Test
    @DisplayName("차감 - subtractOrZero는 0에서 멈춤")
    void testSubtractOrZero() {
        assertEquals(Money.ZERO, Money.of("5.00").subtractOrZero(Money.of("7.50")));
        assertEquals(Money.of("2.50"), Money.of("10.00").subtractOrZero(Money.of("7.50")));
    }

    @Test
    @DisplayName("백분율 - 39.98의 5%는 2.00 (HALF_UP)")
    void testPercentage_RoundsHalfUp() {
        // Given
        Money subtotal = Money.of("39.98");

        // When & Then
        assertEquals(Money.of("2.00"), subtotal.percentage(5));
        assertEquals(Money.of("8.00"), subtotal.percentage(20));
        assertEquals(Money.of("0.01"), Money.of("0.10").percentage(5));
    }

    @Test
    @DisplayName("곱셈 - 수량만큼 곱함")
    void testMultiply() {
        assertEquals(Money.of("39.98"), Money.of("19.99").multiply(2));
    }

    @Test
    @DisplayName("비교 - 스케일이 달라도 같은 금액이면 동등")
    void testEquals_IgnoresScale() {
        assertEquals(Money.of(new BigDecimal("2.0")), Money.of(new BigDecimal("2.000")));
        assertEquals(Money.of("2.0").hashCode(), Money.of("2.00").hashCode());
        assertTrue(Money.of("2.01").isGreaterThan(Money.of("2.00")));
    }

    // ========== 표시 ==========

    @Test
    @DisplayName("표시 형식 - 달러 기호와 천 단위 구분자")
    void testFormat() {
        assertEquals("$1,234.50", Money.of("1234.5").format());
        assertEquals("$0.00", Money.ZERO.format());
    }
}

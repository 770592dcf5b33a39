package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order / OrderLine 도메인 테스트
 * - 가격 스냅샷 (VIP 여부)
 * - 주문 생성 규칙, 총액 계산
 */
@DisplayName("Order 도메인 테스트")
class OrderTest {

    private static final LocalDateTime PLACED_AT = LocalDateTime.of(2026, 5, 1, 11, 0);

    private Product notebook;

    @BeforeEach
    void setUp() {
        notebook = Product.createProduct("P009", "A4 Notebook", "Campus", "Ruled 96 pages",
                "Stationery", "Paper", Money.of("19.99"), Money.of("17.99"), 12);
    }

    @Test
    @DisplayName("항목 스냅샷 - VIP는 회원가, 일반은 정가")
    void testSnapshot() {
        OrderLine regular = OrderLine.snapshot(notebook, 2, false);
        OrderLine member = OrderLine.snapshot(notebook, 2, true);

        assertEquals(Money.of("39.98"), regular.getLineTotal());
        assertEquals(Money.of("17.99"), member.getUnitPrice());
        assertEquals(Money.of("35.98"), member.getLineTotal());
        assertEquals(Money.of("19.99"), member.getRegularPrice());
    }

    @Test
    @DisplayName("주문 생성 - 배송 주문은 매장 ID를 버리고 총액 계산")
    void testCreateOrder_Delivery() {
        Order order = Order.createOrder("jo@example.com", FulfilmentMode.DELIVERY, "1 Test St", "S1", null, false,
                List.of(OrderLine.snapshot(notebook, 2, false)),
                Money.of("39.98"), Money.ZERO, Money.ZERO, Money.of("20.00"), PLACED_AT);

        assertTrue(order.getOrderId().matches("ORD-[0-9A-F]{8}"));
        assertNull(order.getStoreId());
        assertEquals("1 Test St", order.getDeliveryAddress());
        assertEquals(Money.of("59.98"), order.getTotal());
        assertEquals(2, order.totalUnits());
        assertFalse(order.hasPromo());
    }

    @Test
    @DisplayName("총액 - 할인이 소계를 넘어도 0 미만이 되지 않음")
    void testComputeTotal_NeverNegative() {
        assertEquals(Money.ZERO, Order.computeTotal(Money.of("10.00"), Money.of("8.00"), Money.of("5.00"), Money.ZERO));
        assertEquals(Money.of("20.00"),
                Order.computeTotal(Money.of("10.00"), Money.of("10.00"), Money.ZERO, Money.of("20.00")));
    }

    @Test
    @DisplayName("주문 생성 실패 - 항목 없음, 수량 0")
    void testCreateOrder_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> Order.createOrder("jo@example.com", FulfilmentMode.PICKUP,
                null, "S1", null, false, List.of(), Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO, PLACED_AT));
        assertThrows(IllegalArgumentException.class, () -> OrderLine.snapshot(notebook, 0, false));
    }
}

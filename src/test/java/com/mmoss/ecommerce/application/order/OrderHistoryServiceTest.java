package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.common.exception.ApplicationException;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderNotFoundException;
import com.mmoss.ecommerce.domain.order.OrderRepository;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.support.BaseUnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * OrderHistoryService 단위 테스트
 * - 본인 주문만 조회
 * - 관리자는 전체 조회
 */
@DisplayName("OrderHistoryService 단위 테스트")
class OrderHistoryServiceTest extends BaseUnitTest {

    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private OrderHistoryService orderHistoryService;

    private User owner;
    private User other;
    private User admin;
    private Order order;

    @BeforeEach
    void setUp() {
        owner = User.createCustomer("jo@example.com", "hash", "Jo", "Shopper", false, Money.ZERO);
        other = User.createCustomer("kim@example.com", "hash", "Kim", "Other", false, Money.ZERO);
        admin = User.createAdmin("admin@monash.edu", "hash", "Ada", "Admin");
        order = Order.builder()
                .orderId("ORD-1A2B3C4D")
                .email("jo@example.com")
                .placedAt(LocalDateTime.of(2026, 5, 1, 11, 0))
                .fulfilment(FulfilmentMode.PICKUP)
                .storeId("S1")
                .lines(List.of())
                .subtotal(Money.ZERO)
                .studentDiscount(Money.ZERO)
                .promoDiscount(Money.ZERO)
                .deliveryFee(Money.ZERO)
                .total(Money.ZERO)
                .build();
    }

    @Test
    @DisplayName("주문 상세 - 본인과 관리자만 조회")
    void testFindOrder() {
        when(orderRepository.findByKey(order.getOrderId())).thenReturn(Optional.of(order));

        assertSame(order, orderHistoryService.findOrder(owner, order.getOrderId()));
        assertSame(order, orderHistoryService.findOrder(admin, order.getOrderId()));
        assertThrows(OrderNotFoundException.class, () -> orderHistoryService.findOrder(other, order.getOrderId()));
    }

    @Test
    @DisplayName("주문 상세 - 없는 주문")
    void testFindOrder_NotFound() {
        when(orderRepository.findByKey("ORD-MISSING")).thenReturn(Optional.empty());

        assertThrows(OrderNotFoundException.class, () -> orderHistoryService.findOrder(owner, "ORD-MISSING"));
    }

    @Test
    @DisplayName("내 주문 목록 - 고객 이메일로 조회")
    void testFindMyOrders() {
        when(orderRepository.findByEmail("jo@example.com")).thenReturn(List.of(order));

        assertEquals(1, orderHistoryService.findMyOrders(owner).size());
        verify(orderRepository).findByEmail("jo@example.com");
    }

    @Test
    @DisplayName("전체 주문 - 관리자 전용")
    void testFindAllOrders() {
        when(orderRepository.findAll()).thenReturn(List.of(order));

        assertEquals(1, orderHistoryService.findAllOrders(admin).size());
        assertThrows(ApplicationException.class, () -> orderHistoryService.findAllOrders(owner));
    }
}

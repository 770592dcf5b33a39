package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.application.common.AccessGuard;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderNotFoundException;
import com.mmoss.ecommerce.domain.order.OrderRepository;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * OrderHistoryService - 주문 내역 조회 (읽기 전용)
 *
 * - 고객: 본인 주문만 (로그 순서)
 * - 관리자: 전체 주문
 */
@Service
public class OrderHistoryService {

    private final OrderRepository orderRepository;

    public OrderHistoryService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    public List<Order> findMyOrders(User customer) {
        AccessGuard.requireCustomer(customer);
        return orderRepository.findByEmail(customer.getEmail());
    }

    /**
     * @throws OrderNotFoundException 주문이 없거나 조회 권한이 없는 경우
     */
    public Order findOrder(User user, String orderId) {
        Order order = orderRepository.findByKey(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!user.isAdmin() && !order.getEmail().equals(user.getEmail())) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    public List<Order> findAllOrders(User admin) {
        AccessGuard.requireAdmin(admin);
        return orderRepository.findAll();
    }
}

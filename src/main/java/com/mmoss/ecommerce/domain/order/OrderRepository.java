package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.domain.common.repository.KeyedRepository;

import java.util.List;

/**
 * OrderRepository - 주문 로그 저장소 (Domain 계층)
 *
 * 주문은 추가만 가능하다. upsert는 새 주문 추가로 동작하며
 * 이미 존재하는 주문 ID는 거부한다.
 */
public interface OrderRepository extends KeyedRepository<String, Order> {

    /**
     * 주문을 로그 끝에 추가하고 즉시 기록
     *
     * @throws IllegalStateException 같은 주문 ID가 이미 존재
     * @throws com.mmoss.ecommerce.common.exception.PersistenceException 기록 실패
     */
    void append(Order order);

    /**
     * 전체 주문 (로그 순서)
     */
    List<Order> findAll();

    /**
     * 고객 주문 목록 (로그 순서)
     */
    List<Order> findByEmail(String email);

    /**
     * 고객의 픽업 주문 이력 존재 여부
     */
    boolean hasPickupOrder(String email);
}

package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.application.order.dto.CheckoutQuote;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.order.OrderRepository;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.UserNotFoundException;
import com.mmoss.ecommerce.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * CheckoutTransactionService - 주문 확정 원자적 처리
 *
 * 책임:
 * - 확정 직전 재고/잔액 재검증 (모든 검증을 변경 전에 수행)
 * - 재고 차감, 잔액 차감, 주문 기록
 * - 저장 실패 시 보상 처리 (재고/잔액 복원 후 재저장)
 *
 * 처리 순서:
 * 1. 검증: 모든 상품 존재 및 재고 충분, 잔액 충분
 * 2. 주문 생성 (검증 실패 시 변경 없음)
 * 3. 변경: 재고 차감 → 잔액 차감 (메모리)
 * 4. 저장: products.csv → users.csv → orders.csv 추가
 * 5. 저장 단계의 어떤 실패든: 메모리 상태 복원 → products/users 재저장 → 원래 예외 전파
 */
@Service
public class CheckoutTransactionService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTransactionService.class);

    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final OrderValidator orderValidator;
    private final Clock clock;

    public CheckoutTransactionService(ProductRepository productRepository,
                                      UserRepository userRepository,
                                      OrderRepository orderRepository,
                                      OrderValidator orderValidator,
                                      Clock clock) {
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.orderValidator = orderValidator;
        this.clock = clock;
    }

    /**
     * 견적을 주문으로 확정
     *
     * @param customer 결제 고객
     * @param quote 방금 계산된 견적
     * @return 기록된 주문
     * @throws ProductNotFoundException 견적 이후 상품이 삭제된 경우
     * @throws com.mmoss.ecommerce.domain.product.OutOfStockException 재고 부족
     * @throws com.mmoss.ecommerce.domain.user.InsufficientFundsException 잔액 부족
     * @throws PersistenceException 저장 실패 (상태는 복원됨)
     * @throws IllegalStateException 주문 기록 거부 (상태는 복원됨)
     */
    public Order commit(User customer, CheckoutQuote quote) {
        // 1. 검증 (변경 없음)
        User account = userRepository.findByKey(customer.getEmail())
                .orElseThrow(() -> new UserNotFoundException(customer.getEmail()));
        List<Product> products = new ArrayList<>();
        for (OrderLine line : quote.getLines()) {
            Product product = productRepository.findByKey(line.getSku())
                    .orElseThrow(() -> new ProductNotFoundException(line.getSku()));
            orderValidator.validateStock(product, line.getQuantity());
            products.add(product);
        }
        orderValidator.validateFunds(account, quote.getTotal());

        // 2. 주문 생성 (변경 전)
        Order order = Order.createOrder(
                account.getEmail(),
                quote.getFulfilment(),
                quote.getDeliveryAddress(),
                quote.getStoreId(),
                quote.getAppliedPromoCode(),
                quote.isVipPricing(),
                quote.getLines(),
                quote.getSubtotal(),
                quote.getStudentDiscount(),
                quote.getPromoDiscount(),
                quote.getDeliveryFee(),
                LocalDateTime.now(clock));

        // 3. 변경
        for (int i = 0; i < products.size(); i++) {
            products.get(i).deductStock(quote.getLines().get(i).getQuantity());
        }
        account.debit(quote.getTotal());

        // 4. 저장
        try {
            productRepository.saveAll();
            userRepository.saveAll();
            orderRepository.append(order);
        } catch (RuntimeException e) {
            log.error("[CheckoutTransactionService] 주문 저장 실패, 보상 처리 시작: email={}, total={}",
                    account.getEmail(), quote.getTotal().toPlainString(), e);
            compensate(account, products, quote);
            throw e;
        }

        log.info("[CheckoutTransactionService] 주문 확정: orderId={}, email={}, total={}",
                order.getOrderId(), order.getEmail(), order.getTotal().toPlainString());
        return order;
    }

    /**
     * 보상 처리: 재고/잔액 복원 후 재저장
     *
     * 재저장 실패는 원래 예외를 가리지 않도록 로그만 남긴다.
     */
    private void compensate(User account, List<Product> products, CheckoutQuote quote) {
        for (int i = 0; i < products.size(); i++) {
            products.get(i).restoreStock(quote.getLines().get(i).getQuantity());
        }
        if (quote.getTotal().isPositive()) {
            account.credit(quote.getTotal());
        }
        try {
            productRepository.saveAll();
            userRepository.saveAll();
            log.info("[CheckoutTransactionService] 보상 처리 완료: email={}", account.getEmail());
        } catch (RuntimeException e) {
            log.error("[CheckoutTransactionService] 보상 재저장 실패, 파일 상태 확인 필요: email={}",
                    account.getEmail(), e);
        }
    }
}

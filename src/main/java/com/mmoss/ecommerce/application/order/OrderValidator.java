package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.application.common.AccessGuard;
import com.mmoss.ecommerce.application.order.dto.CheckoutRequest;
import com.mmoss.ecommerce.domain.cart.Cart;
import com.mmoss.ecommerce.domain.cart.EmptyCartException;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.InvalidAddressException;
import com.mmoss.ecommerce.domain.product.OutOfStockException;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.store.StoreNotFoundException;
import com.mmoss.ecommerce.domain.store.StoreRepository;
import com.mmoss.ecommerce.domain.user.InsufficientFundsException;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

/**
 * OrderValidator - 결제 유효성 검증 전담
 *
 * 책임:
 * - 결제 주체 검증 (고객 계정)
 * - 장바구니 검증 (비어 있지 않음)
 * - 수령 방식 검증 (배송지 필수, 픽업 매장 존재)
 * - 재고 검증 (실시간 재고 기준)
 * - 잔액 검증 (부분 결제 없음)
 *
 * 설계 원칙:
 * - 읽기 전용 검증 (상태 변경 없음)
 * - 실패 시 즉시 도메인 예외
 */
@Component
public class OrderValidator {

    private final StoreRepository storeRepository;

    public OrderValidator(StoreRepository storeRepository) {
        this.storeRepository = storeRepository;
    }

    /**
     * @throws com.mmoss.ecommerce.common.exception.ApplicationException 고객 계정이 아닌 경우
     * @throws EmptyCartException 장바구니가 비어 있는 경우
     */
    public void validateCheckoutStart(User customer, Cart cart) {
        AccessGuard.requireCustomer(customer);
        if (cart == null || cart.isEmpty()) {
            throw new EmptyCartException();
        }
    }

    /**
     * 수령 방식 검증
     *
     * @return 픽업 매장 (픽업이 아니거나 매장 미지정 시 null)
     * @throws IllegalArgumentException 수령 방식 누락
     * @throws InvalidAddressException 배송 주문에 배송지 없음
     * @throws StoreNotFoundException 존재하지 않는 픽업 매장
     */
    public PickupStore validateFulfilment(CheckoutRequest request) {
        if (request.getFulfilment() == null) {
            throw new IllegalArgumentException("Choose delivery or pickup");
        }
        if (request.getFulfilment() == FulfilmentMode.DELIVERY) {
            if (request.getDeliveryAddress() == null || request.getDeliveryAddress().isBlank()) {
                throw new InvalidAddressException();
            }
            return null;
        }
        if (!request.hasStoreId()) {
            return null;
        }
        return storeRepository.findByKey(request.getStoreId())
                .orElseThrow(() -> new StoreNotFoundException(request.getStoreId().trim()));
    }

    /**
     * @throws OutOfStockException 요청 수량이 실시간 재고를 초과
     */
    public void validateStock(Product product, int requestedQuantity) {
        if (!product.hasStock(requestedQuantity)) {
            throw new OutOfStockException(product.getSku(), requestedQuantity, product.getStock());
        }
    }

    /**
     * @throws InsufficientFundsException 잔액 부족
     */
    public void validateFunds(User customer, Money total) {
        if (!customer.canAfford(total)) {
            throw new InsufficientFundsException(total, customer.getFunds());
        }
    }
}

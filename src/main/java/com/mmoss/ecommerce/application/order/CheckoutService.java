package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.application.order.dto.CheckoutQuote;
import com.mmoss.ecommerce.application.order.dto.CheckoutRequest;
import com.mmoss.ecommerce.application.promotion.PromotionService;
import com.mmoss.ecommerce.domain.cart.Cart;
import com.mmoss.ecommerce.domain.cart.CartLine;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.promotion.InvalidPromoException;
import com.mmoss.ecommerce.domain.promotion.Promotion;
import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * CheckoutService - 결제 흐름 조정자 (Application 계층)
 *
 * 책임:
 * - 견적 계산 (quote): 검증 → 가격 → 할인 → 배송비 → 잔액 확인
 * - 주문 확정 (confirm): 실시간 데이터로 견적 재계산 → 원자적 확정 → 장바구니 비움
 * - 검증/계산/트랜잭션을 각 담당 컴포넌트에 위임
 *
 * 아키텍처:
 * - OrderValidator: 모든 유효성 검증 담당
 * - OrderCalculator: 모든 금액 계산 담당
 * - PromotionService: 프로모션 코드 자격 판정
 * - CheckoutTransactionService: 재고/잔액 변경과 저장, 실패 시 보상
 *
 * 플로우 (견적):
 * 1. 고객/장바구니 검증
 * 2. 수령 방식 검증 (배송지, 픽업 매장)
 * 3. 항목별 상품 조회 및 재고 검증, 단가 스냅샷 (VIP면 회원가)
 * 4. 학생 픽업 할인, 배송비
 * 5. 프로모션 코드 (실패 시 안내 메시지만 남기고 계속)
 * 6. 최종 금액 및 잔액 검증
 *
 * 실패 시 장바구니는 유지되고, 성공 시에만 비워진다.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final ProductRepository productRepository;
    private final OrderValidator orderValidator;
    private final OrderCalculator orderCalculator;
    private final PromotionService promotionService;
    private final CheckoutTransactionService checkoutTransactionService;
    private final Clock clock;

    public CheckoutService(ProductRepository productRepository,
                           OrderValidator orderValidator,
                           OrderCalculator orderCalculator,
                           PromotionService promotionService,
                           CheckoutTransactionService checkoutTransactionService,
                           Clock clock) {
        this.productRepository = productRepository;
        this.orderValidator = orderValidator;
        this.orderCalculator = orderCalculator;
        this.promotionService = promotionService;
        this.checkoutTransactionService = checkoutTransactionService;
        this.clock = clock;
    }

    /**
     * 결제 견적 계산 (상태 변경 없음)
     *
     * @throws com.mmoss.ecommerce.domain.cart.EmptyCartException 빈 장바구니
     * @throws com.mmoss.ecommerce.domain.order.InvalidAddressException 배송지 없음
     * @throws com.mmoss.ecommerce.domain.store.StoreNotFoundException 픽업 매장 없음
     * @throws ProductNotFoundException 장바구니 상품이 카탈로그에 없음
     * @throws com.mmoss.ecommerce.domain.product.OutOfStockException 재고 부족
     * @throws com.mmoss.ecommerce.domain.user.InsufficientFundsException 잔액 부족
     */
    public CheckoutQuote quote(User customer, Cart cart, CheckoutRequest request) {
        orderValidator.validateCheckoutStart(customer, cart);
        PickupStore pickupStore = orderValidator.validateFulfilment(request);

        LocalDate today = LocalDate.now(clock);
        boolean vipPricing = customer.isVipActive(today);
        List<OrderLine> lines = snapshotLines(cart, vipPricing);

        Money subtotal = orderCalculator.calculateSubtotal(lines);
        boolean studentPickup = orderCalculator.isStudentPickupDiscountApplicable(customer, request.getFulfilment());
        Money studentDiscount = orderCalculator.calculateStudentDiscount(subtotal, customer, request.getFulfilment());
        Money deliveryFee = orderCalculator.calculateDeliveryFee(customer, request.getFulfilment());

        Promotion promotion = null;
        String promoNotice = null;
        if (request.hasPromoCode()) {
            try {
                promotion = promotionService.resolveForCheckout(
                        request.getPromoCode(), customer, request.getFulfilment(), studentPickup);
            } catch (InvalidPromoException e) {
                promoNotice = e.getCode() + " was not applied: " + e.getReason();
                log.info("[CheckoutService] 프로모션 미적용, 할인 없이 진행: email={}, code={}, reason={}",
                        customer.getEmail(), e.getCode(), e.getReason());
            }
        }
        Money promoDiscount = orderCalculator.calculatePromoDiscount(subtotal, promotion);
        Money total = orderCalculator.calculateTotal(subtotal, studentDiscount, promoDiscount, deliveryFee);

        orderValidator.validateFunds(customer, total);

        return CheckoutQuote.builder()
                .customerEmail(customer.getEmail())
                .fulfilment(request.getFulfilment())
                .deliveryAddress(request.getDeliveryAddress() == null ? null : request.getDeliveryAddress().trim())
                .pickupStore(pickupStore)
                .vipPricing(vipPricing)
                .lines(lines)
                .subtotal(subtotal)
                .studentDiscount(studentDiscount)
                .promoDiscount(promoDiscount)
                .deliveryFee(deliveryFee)
                .total(total)
                .appliedPromoCode(promotion == null ? null : promotion.getCode())
                .promoNotice(promoNotice)
                .fundsAvailable(customer.getFunds())
                .build();
    }

    /**
     * 주문 확정
     *
     * 견적을 실시간 데이터로 다시 계산한 뒤 확정한다 (가격 스냅샷은 이 시점 기준).
     * 성공 시 장바구니를 비운다.
     *
     * @return 기록된 주문
     * @throws com.mmoss.ecommerce.common.exception.PersistenceException 저장 실패 (재고/잔액 복원됨)
     */
    public Order confirm(User customer, Cart cart, CheckoutRequest request) {
        log.info("[CheckoutService] 주문 확정 요청: email={}, fulfilment={}, units={}",
                customer.getEmail(), request.getFulfilment(), cart.totalUnits());

        CheckoutQuote quote = quote(customer, cart, request);
        Order order = checkoutTransactionService.commit(customer, quote);
        cart.clear();

        handlePostOrderProcessing(order);
        return order;
    }

    private List<OrderLine> snapshotLines(Cart cart, boolean vipPricing) {
        List<OrderLine> lines = new ArrayList<>();
        for (CartLine cartLine : cart.list()) {
            Product product = productRepository.findByKey(cartLine.getSku())
                    .orElseThrow(() -> new ProductNotFoundException(cartLine.getSku()));
            orderValidator.validateStock(product, cartLine.getQuantity());
            lines.add(OrderLine.snapshot(product, cartLine.getQuantity(), vipPricing));
        }
        return lines;
    }

    /**
     * 확정 이후 처리 (현재는 로그만 남김)
     */
    private void handlePostOrderProcessing(Order order) {
        log.info("[CheckoutService] 주문 처리 완료: orderId={}, fulfilment={}, promo={}, total={}",
                order.getOrderId(), order.getFulfilment(), order.getPromoCode(), order.getTotal().toPlainString());
    }
}

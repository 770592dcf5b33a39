package com.mmoss.ecommerce.application.order;

import com.mmoss.ecommerce.application.order.dto.CheckoutQuote;
import com.mmoss.ecommerce.application.order.dto.CheckoutRequest;
import com.mmoss.ecommerce.application.promotion.PromotionService;
import com.mmoss.ecommerce.common.exception.ApplicationException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import com.mmoss.ecommerce.domain.cart.Cart;
import com.mmoss.ecommerce.domain.cart.EmptyCartException;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.InvalidAddressException;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.product.OutOfStockException;
import com.mmoss.ecommerce.domain.promotion.PromotionCatalog;
import com.mmoss.ecommerce.domain.store.StoreNotFoundException;
import com.mmoss.ecommerce.domain.user.InsufficientFundsException;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.VipMembership;
import com.mmoss.ecommerce.support.ShopTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.mmoss.ecommerce.support.ShopTestFixture.NOTEBOOK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CheckoutService 테스트 (임시 디렉터리 CSV 저장소 사용)
 *
 * 테스트 대상:
 * - 견적 계산 (배송비, 학생 할인, 프로모션, VIP 가격)
 * - 주문 확정 (재고 차감, 잔액 차감, 주문 기록, 장바구니 비움)
 * - 실패 시 상태 불변
 */
@DisplayName("CheckoutService 테스트")
class CheckoutServiceTest {

    @TempDir
    Path dataDir;

    private ShopTestFixture fixture;
    private CheckoutService checkoutService;
    private Cart cart;

    @BeforeEach
    void setUp() {
        fixture = new ShopTestFixture(dataDir).withCatalog(12);
        OrderValidator orderValidator = new OrderValidator(fixture.storeRepository);
        PromotionService promotionService = new PromotionService(
                PromotionCatalog.withDefaults(), fixture.orderRepository, fixture.policy);
        CheckoutTransactionService transactionService = new CheckoutTransactionService(
                fixture.productRepository, fixture.userRepository, fixture.orderRepository,
                orderValidator, ShopTestFixture.CLOCK);
        checkoutService = new CheckoutService(fixture.productRepository, orderValidator,
                new OrderCalculator(fixture.policy), promotionService, transactionService, ShopTestFixture.CLOCK);
        cart = new Cart();
    }

    private static CheckoutRequest delivery(String address) {
        return CheckoutRequest.builder().fulfilment(FulfilmentMode.DELIVERY).deliveryAddress(address).build();
    }

    private static CheckoutRequest pickup(String promoCode) {
        return CheckoutRequest.builder().fulfilment(FulfilmentMode.PICKUP).storeId("S1").promoCode(promoCode).build();
    }

    // ========== 정상 주문 ==========

    @Test
    @DisplayName("일반 고객 배송 주문 - 재고/잔액 차감, 주문 기록, 장바구니 비움")
    void testConfirm_ShopperDelivery() {
        // Given
        User shopper = fixture.addCustomer("jo@example.com", false, "1000.00");
        cart.add(NOTEBOOK, 2);

        // When
        Order order = checkoutService.confirm(shopper, cart, delivery("5 Side St, Clayton VIC 3800"));

        // Then
        assertEquals(Money.of("39.98"), order.getSubtotal());
        assertEquals(Money.of("20.00"), order.getDeliveryFee());
        assertEquals(Money.of("59.98"), order.getTotal());
        assertEquals("5 Side St, Clayton VIC 3800", order.getDeliveryAddress());
        assertEquals(Money.of("940.02"), shopper.getFunds());
        assertEquals(10, fixture.stockOf(NOTEBOOK));
        assertTrue(cart.isEmpty());

        List<Order> saved = fixture.orderRepository.findByEmail("jo@example.com");
        assertEquals(1, saved.size());
        assertEquals(order.getOrderId(), saved.get(0).getOrderId());
    }

    @Test
    @DisplayName("학생 픽업 주문 - 5% 학생 할인, 배송비 없음")
    void testConfirm_StudentPickup() {
        User student = fixture.addCustomer("sam@student.monash.edu", true, "100.00");
        cart.add(NOTEBOOK, 2);

        Order order = checkoutService.confirm(student, cart, pickup(null));

        assertEquals(Money.of("2.00"), order.getStudentDiscount());
        assertEquals(Money.ZERO, order.getDeliveryFee());
        assertEquals(Money.of("37.98"), order.getTotal());
        assertEquals("S1", order.getStoreId());
        assertNull(order.getDeliveryAddress());
        assertEquals(Money.of("62.02"), student.getFunds());
    }

    @Test
    @DisplayName("교직원 픽업 + STAFF5 - 5% 프로모션 할인")
    void testConfirm_StaffPromo() {
        User staff = fixture.addCustomer("alex@monash.edu", false, "100.00");
        cart.add(NOTEBOOK, 2);

        Order order = checkoutService.confirm(staff, cart, pickup("staff5"));

        assertEquals(PromotionCatalog.STAFF_5, order.getPromoCode());
        assertEquals(Money.of("2.00"), order.getPromoDiscount());
        assertEquals(Money.of("37.98"), order.getTotal());
    }

    @Test
    @DisplayName("VIP 회원 - 회원가로 계산")
    void testQuote_VipPricing() {
        User vip = fixture.addCustomer("vip@example.com", false, "100.00");
        vip.applyMembership(VipMembership.none().extend(1, ShopTestFixture.TODAY));
        cart.add(NOTEBOOK, 2);

        CheckoutQuote quote = checkoutService.quote(vip, cart, delivery("1 Test St"));

        assertTrue(quote.isVipPricing());
        assertEquals(Money.of("35.98"), quote.getSubtotal());
        assertEquals(Money.of("55.98"), quote.getTotal());
        assertEquals(Money.of("44.02"), quote.getFundsAfterPayment());
    }

    // ========== 프로모션 ==========

    @Test
    @DisplayName("NEWMONASH20 - 첫 픽업 주문에만 적용, 두 번째는 안내 후 할인 없이 진행")
    void testNewMonash_FirstPickupOnly() {
        User shopper = fixture.addCustomer("jo@example.com", false, "1000.00");
        cart.add(NOTEBOOK, 2);

        Order first = checkoutService.confirm(shopper, cart, pickup("NEWMONASH20"));
        assertEquals(Money.of("8.00"), first.getPromoDiscount());
        assertEquals(Money.of("31.98"), first.getTotal());

        cart.add(NOTEBOOK, 2);
        CheckoutQuote second = checkoutService.quote(shopper, cart, pickup("NEWMONASH20"));

        assertNull(second.getAppliedPromoCode());
        assertEquals(Money.ZERO, second.getPromoDiscount());
        assertEquals(Money.of("39.98"), second.getTotal());
        assertThat(second.getPromoNotice()).contains("first pickup order");
    }

    @Test
    @DisplayName("학생 픽업 - 프로모션과 학생 할인 중복 불가, 학생 할인만 적용")
    void testQuote_StudentNoStacking() {
        User student = fixture.addCustomer("sam@student.monash.edu", true, "100.00");
        cart.add(NOTEBOOK, 2);

        CheckoutQuote quote = checkoutService.quote(student, cart, pickup("NEWMONASH20"));

        assertTrue(quote.hasPromoNotice());
        assertThat(quote.getPromoNotice()).contains("student pickup discount");
        assertEquals(Money.of("2.00"), quote.getStudentDiscount());
        assertEquals(Money.ZERO, quote.getPromoDiscount());
        assertEquals(Money.of("37.98"), quote.getTotal());
    }

    @Test
    @DisplayName("없는 프로모션 코드 - 안내 후 할인 없이 진행")
    void testQuote_UnknownPromo() {
        User shopper = fixture.addCustomer("jo@example.com", false, "100.00");
        cart.add(NOTEBOOK, 1);

        CheckoutRequest request = CheckoutRequest.builder()
                .fulfilment(FulfilmentMode.DELIVERY)
                .deliveryAddress("1 Test St")
                .promoCode("free")
                .build();

        CheckoutQuote quote = checkoutService.quote(shopper, cart, request);

        // 19.99 + 배송비 20.00, 할인 없음
        assertEquals("FREE was not applied: Invalid promotion code", quote.getPromoNotice());
        assertEquals(Money.ZERO, quote.getPromoDiscount());
        assertEquals(Money.of("39.99"), quote.getTotal());
    }

    // ========== 실패 시 상태 불변 ==========

    @Test
    @DisplayName("재고 부족 - 재고/잔액/장바구니 변경 없음")
    void testConfirm_OutOfStock() {
        fixture.productRepository.upsert(
                fixture.productRepository.findByKey(NOTEBOOK).orElseThrow().toBuilder().stock(1).build());
        User shopper = fixture.addCustomer("jo@example.com", false, "100.00");
        cart.add(NOTEBOOK, 2);

        OutOfStockException exception = assertThrows(OutOfStockException.class,
                () -> checkoutService.confirm(shopper, cart, delivery("1 Test St")));

        assertEquals(1, exception.getAvailable());
        assertEquals(1, fixture.stockOf(NOTEBOOK));
        assertEquals(Money.of("100.00"), shopper.getFunds());
        assertEquals(2, cart.quantityOf(NOTEBOOK));
        assertTrue(fixture.orderRepository.findAll().isEmpty());
    }

    @Test
    @DisplayName("잔액 부족 - 부분 결제 없음")
    void testConfirm_InsufficientFunds() {
        User shopper = fixture.addCustomer("jo@example.com", false, "50.00");
        cart.add(NOTEBOOK, 2);

        InsufficientFundsException exception = assertThrows(InsufficientFundsException.class,
                () -> checkoutService.confirm(shopper, cart, delivery("1 Test St")));

        assertEquals(Money.of("9.98"), exception.getShortfall());
        assertEquals(Money.of("50.00"), shopper.getFunds());
        assertEquals(12, fixture.stockOf(NOTEBOOK));
        assertFalse(cart.isEmpty());
    }

    @Test
    @DisplayName("빈 장바구니 - 예외")
    void testQuote_EmptyCart() {
        User shopper = fixture.addCustomer("jo@example.com", false, "50.00");

        EmptyCartException exception = assertThrows(EmptyCartException.class,
                () -> checkoutService.quote(shopper, cart, delivery("1 Test St")));
        assertEquals("Your cart is empty", exception.getMessage());
    }

    @Test
    @DisplayName("배송지 없음 / 없는 매장 - 예외")
    void testQuote_InvalidFulfilment() {
        User shopper = fixture.addCustomer("jo@example.com", false, "50.00");
        cart.add(NOTEBOOK, 1);

        assertThrows(InvalidAddressException.class, () -> checkoutService.quote(shopper, cart, delivery("  ")));
        assertThrows(StoreNotFoundException.class, () -> checkoutService.quote(shopper, cart,
                CheckoutRequest.builder().fulfilment(FulfilmentMode.PICKUP).storeId("S9").build()));
    }

    @Test
    @DisplayName("관리자 계정은 결제 불가")
    void testQuote_AdminDenied() {
        User admin = fixture.addAdmin("admin@monash.edu");
        cart.add(NOTEBOOK, 1);

        ApplicationException exception = assertThrows(ApplicationException.class,
                () -> checkoutService.quote(admin, cart, delivery("1 Test St")));
        assertEquals(ErrorCode.ACCESS_DENIED, exception.getErrorCode());
    }
}

package com.mmoss.ecommerce.domain.order;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Order 도메인 엔티티 (생성 후 불변)
 *
 * 책임:
 * - 확정된 주문의 가격 내역과 항목 스냅샷 보관
 *
 * 핵심 비즈니스 규칙:
 * - 주문 ID: "ORD-" + 대문자 16진수 8자리
 * - total = subtotal - studentDiscount - promoDiscount + deliveryFee (최소 0)
 * - 배송 주문은 배송지, 픽업 주문은 매장 ID(선택)를 가진다
 */
@Getter
@Builder
@AllArgsConstructor
public class Order {

    public static final String ID_PREFIX = "ORD-";

    private final String orderId;
    private final String email;
    private final LocalDateTime placedAt;
    private final FulfilmentMode fulfilment;
    private final String deliveryAddress;
    private final String storeId;
    private final String promoCode;
    private final boolean vipPricing;
    private final List<OrderLine> lines;
    private final Money subtotal;
    private final Money studentDiscount;
    private final Money promoDiscount;
    private final Money deliveryFee;
    private final Money total;

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 항목은 1개 이상
     * - 총액은 구성 금액으로부터 계산
     *
     * @throws IllegalArgumentException 항목 없음 또는 필수 값 누락
     */
    public static Order createOrder(String email, FulfilmentMode fulfilment, String deliveryAddress, String storeId,
                                    String promoCode, boolean vipPricing, List<OrderLine> lines,
                                    Money subtotal, Money studentDiscount, Money promoDiscount, Money deliveryFee,
                                    LocalDateTime placedAt) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Customer email is required");
        }
        if (fulfilment == null) {
            throw new IllegalArgumentException("Fulfilment mode is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("An order needs at least one line");
        }

        return Order.builder()
                .orderId(generateOrderId())
                .email(email)
                .placedAt(placedAt)
                .fulfilment(fulfilment)
                .deliveryAddress(fulfilment == FulfilmentMode.DELIVERY ? deliveryAddress : null)
                .storeId(fulfilment == FulfilmentMode.PICKUP ? storeId : null)
                .promoCode(promoCode)
                .vipPricing(vipPricing)
                .lines(List.copyOf(lines))
                .subtotal(subtotal)
                .studentDiscount(studentDiscount)
                .promoDiscount(promoDiscount)
                .deliveryFee(deliveryFee)
                .total(computeTotal(subtotal, studentDiscount, promoDiscount, deliveryFee))
                .build();
    }

    /**
     * 총액 계산: subtotal - studentDiscount - promoDiscount + deliveryFee, 최소 0
     */
    public static Money computeTotal(Money subtotal, Money studentDiscount, Money promoDiscount, Money deliveryFee) {
        return subtotal.subtractOrZero(studentDiscount)
                .subtractOrZero(promoDiscount)
                .add(deliveryFee);
    }

    public static String generateOrderId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "")
                .substring(0, 8)
                .toUpperCase(Locale.ROOT);
    }

    public List<OrderLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean isPickup() {
        return fulfilment == FulfilmentMode.PICKUP;
    }

    public boolean hasPromo() {
        return promoCode != null && !promoCode.isBlank();
    }

    public int totalUnits() {
        return lines.stream().mapToInt(OrderLine::getQuantity).sum();
    }
}

package com.mmoss.ecommerce.application.cart;

import com.mmoss.ecommerce.application.cart.dto.CartLineView;
import com.mmoss.ecommerce.application.cart.dto.CartSummary;
import com.mmoss.ecommerce.domain.cart.Cart;
import com.mmoss.ecommerce.domain.cart.CartLine;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CartService - 장바구니 관련 비즈니스 로직 (Application 계층)
 *
 * 책임:
 * - 카탈로그에 존재하는 상품만 담기
 * - 수량 변경, 삭제, 비우기 (상한 검증은 Cart 도메인이 담당)
 * - 정가/VIP 가격 기준 요약 계산
 *
 * 장바구니는 세션에만 존재하며 저장하지 않는다.
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final ProductRepository productRepository;
    private final Clock clock;

    public CartService(ProductRepository productRepository, Clock clock) {
        this.productRepository = productRepository;
        this.clock = clock;
    }

    /**
     * 상품 담기 (같은 SKU는 수량 합산)
     *
     * @throws ProductNotFoundException 카탈로그에 없는 SKU
     * @throws com.mmoss.ecommerce.domain.cart.InvalidQuantityException 수량 < 1
     * @throws com.mmoss.ecommerce.domain.cart.CartLimitExceededException 상한 초과
     */
    public void addItem(Cart cart, String sku, int quantity) {
        Product product = productRepository.findByKey(sku)
                .orElseThrow(() -> new ProductNotFoundException(Product.normalizeSku(sku)));
        cart.add(product.getSku(), quantity);
        log.info("[CartService] 장바구니 추가: sku={}, quantity={}, totalUnits={}",
                product.getSku(), quantity, cart.totalUnits());
    }

    public void updateQuantity(Cart cart, String sku, int quantity) {
        cart.updateQuantity(sku, quantity);
        log.info("[CartService] 수량 변경: sku={}, quantity={}", Product.normalizeSku(sku), quantity);
    }

    public void removeItem(Cart cart, String sku) {
        cart.remove(sku);
        log.info("[CartService] 장바구니 삭제: sku={}", Product.normalizeSku(sku));
    }

    public void clear(Cart cart) {
        cart.clear();
        log.info("[CartService] 장바구니 비움");
    }

    /**
     * 장바구니 요약 (카탈로그에서 삭제된 상품은 unavailable로 표시)
     */
    public CartSummary summarize(Cart cart, User customer) {
        boolean vipActive = customer != null && customer.isVipActive(LocalDate.now(clock));
        List<CartLineView> views = new ArrayList<>();
        Money regularSubtotal = Money.ZERO;
        Money memberSubtotal = Money.ZERO;

        for (CartLine line : cart.list()) {
            Optional<Product> found = productRepository.findByKey(line.getSku());
            if (found.isEmpty()) {
                views.add(CartLineView.builder()
                        .sku(line.getSku())
                        .name("(no longer available)")
                        .quantity(line.getQuantity())
                        .unitPrice(Money.ZERO)
                        .memberPrice(Money.ZERO)
                        .lineTotal(Money.ZERO)
                        .memberLineTotal(Money.ZERO)
                        .stock(0)
                        .available(false)
                        .build());
                continue;
            }
            Product product = found.get();
            Money lineTotal = product.getPrice().multiply(line.getQuantity());
            Money memberLineTotal = product.getMemberPrice().multiply(line.getQuantity());
            regularSubtotal = regularSubtotal.add(lineTotal);
            memberSubtotal = memberSubtotal.add(memberLineTotal);
            views.add(CartLineView.builder()
                    .sku(product.getSku())
                    .name(product.getName())
                    .quantity(line.getQuantity())
                    .unitPrice(product.getPrice())
                    .memberPrice(product.getMemberPrice())
                    .lineTotal(lineTotal)
                    .memberLineTotal(memberLineTotal)
                    .stock(product.getStock())
                    .available(true)
                    .build());
        }

        return CartSummary.builder()
                .lines(views)
                .lineCount(cart.lineCount())
                .totalUnits(cart.totalUnits())
                .remainingUnits(cart.remainingUnits())
                .regularSubtotal(regularSubtotal)
                .memberSubtotal(memberSubtotal)
                .vipActive(vipActive)
                .build();
    }
}

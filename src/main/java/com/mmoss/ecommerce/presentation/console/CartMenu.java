package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.cart.CartService;
import com.mmoss.ecommerce.application.cart.dto.CartLineView;
import com.mmoss.ecommerce.application.cart.dto.CartSummary;
import com.mmoss.ecommerce.application.order.CheckoutService;
import com.mmoss.ecommerce.application.order.dto.CheckoutQuote;
import com.mmoss.ecommerce.application.order.dto.CheckoutRequest;
import com.mmoss.ecommerce.application.promotion.PromotionService;
import com.mmoss.ecommerce.application.store.StoreService;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.promotion.Promotion;
import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * CartMenu - 장바구니와 결제 메뉴
 *
 * 결제 흐름:
 * 1. 수령 방식 선택 (배송이면 주소, 픽업이면 매장)
 * 2. 사용 가능한 프로모션 안내 후 코드 입력 (선택)
 * 3. 견적 출력, 확인(Y) 시 주문 확정
 */
@Component
public class CartMenu {

    private final CartService cartService;
    private final CheckoutService checkoutService;
    private final PromotionService promotionService;
    private final StoreService storeService;
    private final ConsoleExceptionHandler exceptionHandler;

    public CartMenu(CartService cartService, CheckoutService checkoutService, PromotionService promotionService,
                    StoreService storeService, ConsoleExceptionHandler exceptionHandler) {
        this.cartService = cartService;
        this.checkoutService = checkoutService;
        this.promotionService = promotionService;
        this.storeService = storeService;
        this.exceptionHandler = exceptionHandler;
    }

    public MenuResult show(ConsoleIO io, ShopSession session) {
        while (true) {
            io.heading("Cart & Checkout");
            io.println("1. View cart");
            io.println("2. Change quantity");
            io.println("3. Remove item");
            io.println("4. Clear cart");
            io.println("5. Checkout");
            io.println("0. Back   M. Main menu");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> printCart(io, cartService.summarize(session.getCart(), session.getUser()));
                case "2" -> {
                    String sku = io.readRequired("SKU");
                    int quantity = io.readInt("New quantity", 1, 10);
                    exceptionHandler.run(io, () -> cartService.updateQuantity(session.getCart(), sku, quantity));
                }
                case "3" -> {
                    String sku = io.readRequired("SKU");
                    exceptionHandler.run(io, () -> cartService.removeItem(session.getCart(), sku));
                }
                case "4" -> {
                    if (io.confirm("Remove every item from your cart?")) {
                        cartService.clear(session.getCart());
                        io.println("Cart cleared.");
                    }
                }
                case "5" -> checkout(io, session);
                case ConsoleIO.BACK -> {
                    return MenuResult.BACK;
                }
                case ConsoleIO.MAIN_MENU -> {
                    return MenuResult.MAIN;
                }
                default -> io.invalidChoice();
            }
        }
    }

    private void printCart(ConsoleIO io, CartSummary summary) {
        if (summary.getLines().isEmpty()) {
            io.println("Your cart is empty.");
            return;
        }
        List<List<String>> rows = new ArrayList<>();
        for (CartLineView line : summary.getLines()) {
            rows.add(List.of(line.getSku(), line.getName(), String.valueOf(line.getQuantity()),
                    line.getUnitPrice().format(), line.getLineTotal().format(),
                    line.getMemberLineTotal().format(), line.exceedsStock() ? "CHECK STOCK" : ""));
        }
        io.println(TableFormatter.format(
                List.of("SKU", "Item", "Qty", "Unit", "Total", "VIP total", ""), rows));
        io.println("Units: " + summary.getTotalUnits() + " (" + summary.getRemainingUnits() + " more allowed)");
        io.println("Regular subtotal: " + summary.getRegularSubtotal().format());
        io.println("VIP subtotal:     " + summary.getMemberSubtotal().format());
        if (summary.isVipActive()) {
            io.println("VIP prices apply, you save " + summary.getVipSavings().format() + ".");
        } else if (summary.getVipSavings().isPositive()) {
            io.println("VIP members would save " + summary.getVipSavings().format() + " on this cart.");
        }
    }

    private void checkout(ConsoleIO io, ShopSession session) {
        User customer = session.getUser();
        if (session.getCart().isEmpty()) {
            io.println("Your cart is empty.");
            return;
        }
        CheckoutRequest request = readRequest(io, customer);
        if (request == null) {
            return;
        }
        try {
            CheckoutQuote quote = checkoutService.quote(customer, session.getCart(), request);
            ConsoleViews.printQuote(io, quote);
            if (!io.confirm("Place this order?")) {
                io.println("Checkout cancelled, your cart is unchanged.");
                return;
            }
            Order order = checkoutService.confirm(customer, session.getCart(), request);
            io.println("Order " + order.getOrderId() + " placed. Total charged " + order.getTotal().format()
                    + ", remaining funds " + customer.getFunds().format() + ".");
        } catch (RuntimeException e) {
            exceptionHandler.handle(io, e);
        }
    }

    private CheckoutRequest readRequest(ConsoleIO io, User customer) {
        io.println("1. " + FulfilmentMode.DELIVERY.getDisplayName());
        io.println("2. " + FulfilmentMode.PICKUP.getDisplayName());
        io.println("0. Cancel");
        int mode = io.readInt("Fulfilment", 0, 2);
        if (mode == 0) {
            return null;
        }
        CheckoutRequest.CheckoutRequestBuilder builder = CheckoutRequest.builder();
        FulfilmentMode fulfilment = mode == 1 ? FulfilmentMode.DELIVERY : FulfilmentMode.PICKUP;
        builder.fulfilment(fulfilment);

        if (fulfilment == FulfilmentMode.DELIVERY) {
            String address = customer.hasAddress()
                    ? io.prompt("Delivery address (blank for " + customer.getAddress() + ")")
                    : io.readRequired("Delivery address");
            builder.deliveryAddress(address.isEmpty() ? customer.getAddress() : address);
        } else {
            List<PickupStore> stores = storeService.listStores();
            for (PickupStore store : stores) {
                io.println(store.getStoreId() + ". " + store.getName() + " - " + store.getAddress()
                        + " (" + store.getHours() + ")");
            }
            String storeId = io.prompt("Pickup store (blank for any)");
            builder.storeId(storeId.isEmpty() ? null : storeId);
        }

        List<Promotion> eligible = promotionService.eligibleFor(customer, fulfilment);
        if (!eligible.isEmpty()) {
            io.println("Promotions available to you:");
            eligible.forEach(p -> io.println("  " + p.getCode() + " - " + p.getDescription()));
        }
        String promoCode = io.prompt("Promotion code (blank for none)");
        builder.promoCode(promoCode.isEmpty() ? null : promoCode);
        return builder.build();
    }
}

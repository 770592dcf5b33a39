package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.order.dto.CheckoutQuote;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.product.Product;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품, 주문, 견적 화면 출력
 */
public final class ConsoleViews {

    private static final DateTimeFormatter ORDER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private ConsoleViews() {
        throw new AssertionError("ConsoleViews는 인스턴스화할 수 없습니다");
    }

    public static void printProducts(ConsoleIO io, List<Product> products) {
        if (products.isEmpty()) {
            io.println("No products match.");
            return;
        }
        List<List<String>> rows = new ArrayList<>();
        for (Product p : products) {
            rows.add(List.of(p.getSku(), p.getName(), p.getBrand(), p.getCategory(), p.getSubcategory(),
                    p.getPrice().format(), p.getMemberPrice().format(),
                    p.isInStock() ? String.valueOf(p.getStock()) : "OUT"));
        }
        io.println(TableFormatter.format(
                List.of("SKU", "Name", "Brand", "Category", "Subcategory", "Price", "VIP", "Stock"), rows));
    }

    public static void printProductDetail(ConsoleIO io, Product p, LocalDate today) {
        io.heading(p.getName());
        io.println("SKU:          " + p.getSku());
        io.println("Brand:        " + p.getBrand());
        io.println("Category:     " + p.getCategory() + " / " + p.getSubcategory());
        io.println("Description:  " + nullToDash(p.getDescription()));
        io.println("Price:        " + p.getPrice().format() + "  (VIP " + p.getMemberPrice().format()
                + ", save " + p.vipSaving().format() + ")");
        io.println("Stock:        " + (p.isInStock() ? p.getStock() + " available" : "Out of stock"));
        if (p.isFood()) {
            io.println("Expiry date:  " + p.getExpiryDate() + (p.isExpired(today) ? "  (EXPIRED)" : ""));
            io.println("Ingredients:  " + nullToDash(p.getIngredients()));
            io.println("Storage:      " + nullToDash(p.getStorage()));
            io.println("Allergens:    " + nullToDash(p.getAllergens()));
        }
    }

    public static void printQuote(ConsoleIO io, CheckoutQuote quote) {
        io.heading("Order Summary");
        printLines(io, quote.getLines());
        io.println("Pricing:           " + (quote.isVipPricing() ? "VIP member prices" : "Regular prices"));
        io.println("Fulfilment:        " + quote.getFulfilment().getDisplayName()
                + (quote.getDeliveryAddress() != null ? " to " + quote.getDeliveryAddress() : "")
                + (quote.getPickupStore() != null ? " at " + quote.getPickupStore().getName() : ""));
        io.println("Subtotal:          " + quote.getSubtotal().format());
        if (!quote.getStudentDiscount().isZero()) {
            io.println("Student discount: -" + quote.getStudentDiscount().format());
        }
        if (quote.getAppliedPromoCode() != null) {
            io.println("Promo " + quote.getAppliedPromoCode() + ":  -" + quote.getPromoDiscount().format());
        }
        if (quote.hasPromoNotice()) {
            io.println("Note: " + quote.getPromoNotice());
        }
        io.println("Delivery fee:      " + quote.getDeliveryFee().format());
        io.println("TOTAL:             " + quote.getTotal().format());
        io.println("Funds after:       " + quote.getFundsAfterPayment().format()
                + " (available " + quote.getFundsAvailable().format() + ")");
    }

    public static void printOrders(ConsoleIO io, List<Order> orders, boolean showCustomer) {
        if (orders.isEmpty()) {
            io.println("No orders yet.");
            return;
        }
        List<List<String>> rows = new ArrayList<>();
        for (Order o : orders) {
            List<String> row = new ArrayList<>();
            row.add(o.getOrderId());
            if (showCustomer) {
                row.add(o.getEmail());
            }
            row.add(o.getPlacedAt().format(ORDER_TIME));
            row.add(o.getFulfilment().name());
            row.add(String.valueOf(o.totalUnits()));
            row.add(o.hasPromo() ? o.getPromoCode() : "-");
            row.add(o.getTotal().format());
            rows.add(row);
        }
        List<String> headers = new ArrayList<>(List.of("Order", "Placed", "Mode", "Units", "Promo", "Total"));
        if (showCustomer) {
            headers.add(1, "Customer");
        }
        io.println(TableFormatter.format(headers, rows));
    }

    public static void printOrderDetail(ConsoleIO io, Order order) {
        io.heading("Order " + order.getOrderId());
        io.println("Customer:          " + order.getEmail());
        io.println("Placed:            " + order.getPlacedAt().format(ORDER_TIME));
        io.println("Fulfilment:        " + order.getFulfilment().getDisplayName()
                + (order.getDeliveryAddress() != null ? " to " + order.getDeliveryAddress() : "")
                + (order.getStoreId() != null ? " at store " + order.getStoreId() : ""));
        printLines(io, order.getLines());
        io.println("Subtotal:          " + order.getSubtotal().format()
                + (order.isVipPricing() ? " (VIP prices)" : ""));
        io.println("Student discount: -" + order.getStudentDiscount().format());
        io.println("Promo discount:   -" + order.getPromoDiscount().format()
                + (order.hasPromo() ? " (" + order.getPromoCode() + ")" : ""));
        io.println("Delivery fee:      " + order.getDeliveryFee().format());
        io.println("TOTAL:             " + order.getTotal().format());
    }

    private static void printLines(ConsoleIO io, List<OrderLine> lines) {
        List<List<String>> rows = new ArrayList<>();
        for (OrderLine line : lines) {
            rows.add(List.of(line.getSku(), line.getName(), String.valueOf(line.getQuantity()),
                    line.getUnitPrice().format(), line.getLineTotal().format()));
        }
        io.println(TableFormatter.format(List.of("SKU", "Item", "Qty", "Unit", "Line total"), rows));
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}

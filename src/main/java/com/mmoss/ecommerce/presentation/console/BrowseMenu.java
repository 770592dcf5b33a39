package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.cart.CartService;
import com.mmoss.ecommerce.application.product.ProductService;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 상품 둘러보기 메뉴: 전체 목록, 조건 검색, 상세 보기, 장바구니 담기
 */
@Component
public class BrowseMenu {

    private final ProductService productService;
    private final CartService cartService;
    private final ConsoleExceptionHandler exceptionHandler;
    private final Clock clock;

    public BrowseMenu(ProductService productService, CartService cartService,
                      ConsoleExceptionHandler exceptionHandler, Clock clock) {
        this.productService = productService;
        this.cartService = cartService;
        this.exceptionHandler = exceptionHandler;
        this.clock = clock;
    }

    public MenuResult show(ConsoleIO io, ShopSession session) {
        while (true) {
            io.heading("Browse & Shop");
            io.println("1. List all products");
            io.println("2. Filter products");
            io.println("3. View product details");
            io.println("4. Add product to cart");
            io.println("0. Back   M. Main menu");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> ConsoleViews.printProducts(io, productService.browse(ProductFilter.none()));
                case "2" -> ConsoleViews.printProducts(io, productService.browse(readFilter(io, productService)));
                case "3" -> exceptionHandler.run(io, () -> ConsoleViews.printProductDetail(
                        io, productService.getProduct(io.readRequired("SKU")), LocalDate.now(clock)));
                case "4" -> addToCart(io, session);
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

    private void addToCart(ConsoleIO io, ShopSession session) {
        io.println("Cart has " + session.getCart().totalUnits() + " units, "
                + session.getCart().remainingUnits() + " remaining.");
        String sku = io.readRequired("SKU");
        int quantity = io.readInt("Quantity", 1, 10);
        if (exceptionHandler.run(io, () -> cartService.addItem(session.getCart(), sku, quantity))) {
            io.println("Added " + quantity + " x " + sku.toUpperCase() + " to your cart.");
        }
    }

    /**
     * 검색 조건 입력 (모든 항목 선택 사항)
     */
    static ProductFilter readFilter(ConsoleIO io, ProductService productService) {
        List<String> categories = productService.listCategories();
        io.println("Categories: " + String.join(", ", categories));
        String category = io.prompt("Category (blank for any)");
        if (!category.isEmpty()) {
            io.println("Subcategories: " + String.join(", ", productService.listSubcategories(category)));
        }
        String subcategory = io.prompt("Subcategory (blank for any)");
        io.println("Brands: " + String.join(", ", productService.listBrands()));
        String brand = io.prompt("Brand (blank for any)");
        Money priceMin = readOptionalPrice(io, "Minimum price");
        Money priceMax = readOptionalPrice(io, "Maximum price");
        io.println("Availability: 1. In stock  2. Out of stock  (blank for any)");
        String availability = io.prompt("Availability");

        return ProductFilter.builder()
                .category(category)
                .subcategory(subcategory)
                .brand(brand)
                .priceMin(priceMin)
                .priceMax(priceMax)
                .availability(switch (availability) {
                    case "1" -> ProductFilter.Availability.IN_STOCK;
                    case "2" -> ProductFilter.Availability.OUT_OF_STOCK;
                    default -> null;
                })
                .build();
    }

    private static Money readOptionalPrice(ConsoleIO io, String label) {
        while (true) {
            String value = io.prompt(label + " (blank for any)");
            if (value.isEmpty()) {
                return null;
            }
            try {
                return Money.of(value);
            } catch (IllegalArgumentException e) {
                io.println("  Please enter a non-negative amount such as 12.50.");
            }
        }
    }
}

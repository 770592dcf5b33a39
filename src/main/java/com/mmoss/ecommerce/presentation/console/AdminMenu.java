package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.order.OrderHistoryService;
import com.mmoss.ecommerce.application.product.AdminProductService;
import com.mmoss.ecommerce.application.product.ProductService;
import com.mmoss.ecommerce.application.product.dto.ProductCommand;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * AdminMenu - 관리자 메뉴
 *
 * 책임:
 * - 상품 목록/검색, 추가, 수정, 삭제
 * - 전체 주문 조회와 주문 상세
 */
@Component
public class AdminMenu {

    private static final int MAX_STOCK_INPUT = 100_000;

    private final AdminProductService adminProductService;
    private final ProductService productService;
    private final OrderHistoryService orderHistoryService;
    private final ConsoleExceptionHandler exceptionHandler;
    private final Clock clock;

    public AdminMenu(AdminProductService adminProductService, ProductService productService,
                     OrderHistoryService orderHistoryService, ConsoleExceptionHandler exceptionHandler,
                     Clock clock) {
        this.adminProductService = adminProductService;
        this.productService = productService;
        this.orderHistoryService = orderHistoryService;
        this.exceptionHandler = exceptionHandler;
        this.clock = clock;
    }

    public MenuResult show(ConsoleIO io, ShopSession session) {
        User admin = session.getUser();
        while (true) {
            io.heading("Admin  |  " + admin.getEmail());
            io.println("1. List products");
            io.println("2. Filter products");
            io.println("3. Add product");
            io.println("4. Edit product");
            io.println("5. Delete product");
            io.println("6. View all orders");
            io.println("7. Order details");
            io.println("0. Logout");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> ConsoleViews.printProducts(io, adminProductService.listProducts(admin, ProductFilter.none()));
                case "2" -> {
                    ProductFilter filter = BrowseMenu.readFilter(io, productService);
                    ConsoleViews.printProducts(io, adminProductService.listProducts(admin, filter));
                }
                case "3" -> addProduct(io, admin);
                case "4" -> editProduct(io, admin);
                case "5" -> deleteProduct(io, admin);
                case "6" -> ConsoleViews.printOrders(io, orderHistoryService.findAllOrders(admin), true);
                case "7" -> {
                    String orderId = io.readRequired("Order id");
                    exceptionHandler.run(io, () -> ConsoleViews.printOrderDetail(
                            io, orderHistoryService.findOrder(admin, orderId)));
                }
                case ConsoleIO.BACK -> {
                    return MenuResult.LOGOUT;
                }
                case ConsoleIO.MAIN_MENU -> {
                    // 이미 메인 메뉴
                }
                default -> io.invalidChoice();
            }
        }
    }

    private void addProduct(ConsoleIO io, User admin) {
        io.println("Existing categories: " + String.join(", ", productService.listCategories()));
        ProductCommand.ProductCommandBuilder command = ProductCommand.builder()
                .sku(io.readRequired("SKU"))
                .name(io.readRequired("Name"))
                .brand(io.readRequired("Brand"))
                .description(io.prompt("Description"))
                .category(io.readRequired("Category"))
                .subcategory(io.readRequired("Subcategory"))
                .price(io.readMoney("Price"))
                .memberPrice(io.readMoney("VIP member price"))
                .stock(io.readInt("Stock", 0, MAX_STOCK_INPUT));
        boolean food = io.confirm("Is this a food item?");
        command.food(food);
        if (food) {
            command.expiryDate(io.readOptionalDate("Expiry date"))
                    .ingredients(io.prompt("Ingredients"))
                    .storage(io.prompt("Storage instructions"))
                    .allergens(io.prompt("Allergens"));
        }
        exceptionHandler.run(io, () -> {
            Product product = adminProductService.addProduct(admin, command.build());
            io.println("Added " + product.getSku() + " " + product.getName() + ".");
        });
    }

    private void editProduct(ConsoleIO io, User admin) {
        String sku = io.readRequired("SKU");
        if (!exceptionHandler.run(io, () -> ConsoleViews.printProductDetail(
                io, productService.getProduct(sku), LocalDate.now(clock)))) {
            return;
        }
        io.println("Leave a field blank to keep its current value.");
        ProductCommand changes = ProductCommand.builder()
                .name(io.prompt("Name"))
                .brand(io.prompt("Brand"))
                .description(io.prompt("Description"))
                .category(io.prompt("Category"))
                .subcategory(io.prompt("Subcategory"))
                .price(io.readOptionalMoney("Price"))
                .memberPrice(io.readOptionalMoney("VIP member price"))
                .stock(io.readOptionalInt("Stock", 0))
                .food(io.readOptionalYesNo("Food item"))
                .expiryDate(io.readOptionalDate("Expiry date"))
                .ingredients(io.prompt("Ingredients"))
                .storage(io.prompt("Storage instructions"))
                .allergens(io.prompt("Allergens"))
                .build();
        exceptionHandler.run(io, () -> {
            Product product = adminProductService.editProduct(admin, sku, changes);
            io.println("Updated " + product.getSku() + ".");
        });
    }

    private void deleteProduct(ConsoleIO io, User admin) {
        String sku = io.readRequired("SKU");
        if (!io.confirm("Delete product " + sku.toUpperCase() + "?")) {
            return;
        }
        if (exceptionHandler.run(io, () -> adminProductService.deleteProduct(admin, sku))) {
            io.println("Deleted " + sku.toUpperCase() + ".");
        }
    }
}

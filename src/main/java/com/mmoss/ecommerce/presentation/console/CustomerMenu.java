package com.mmoss.ecommerce.presentation.console;

import org.springframework.stereotype.Component;

/**
 * 고객 메인 메뉴
 */
@Component
public class CustomerMenu {

    private final BrowseMenu browseMenu;
    private final CartMenu cartMenu;
    private final ProfileMenu profileMenu;
    private final PromotionMenu promotionMenu;

    public CustomerMenu(BrowseMenu browseMenu, CartMenu cartMenu, ProfileMenu profileMenu,
                        PromotionMenu promotionMenu) {
        this.browseMenu = browseMenu;
        this.cartMenu = cartMenu;
        this.profileMenu = profileMenu;
        this.promotionMenu = promotionMenu;
    }

    /**
     * 로그아웃할 때까지 반복
     */
    public MenuResult show(ConsoleIO io, ShopSession session) {
        while (true) {
            io.heading("Welcome, " + session.getUser().getFullName()
                    + "  |  Funds " + session.getUser().getFunds().format()
                    + "  |  Cart " + session.getCart().totalUnits() + " units");
            io.println("1. Browse & Shop");
            io.println("2. Cart & Checkout");
            io.println("3. Profile & Membership");
            io.println("4. Promotions");
            io.println("0. Logout");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> browseMenu.show(io, session);
                case "2" -> cartMenu.show(io, session);
                case "3" -> profileMenu.show(io, session);
                case "4" -> promotionMenu.show(io, session);
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
}

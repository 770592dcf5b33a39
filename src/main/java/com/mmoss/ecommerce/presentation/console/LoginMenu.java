package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.user.AccountService;
import com.mmoss.ecommerce.domain.user.AuthenticationFailedException;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

/**
 * LoginMenu - 로그인과 역할별 메뉴 분기
 *
 * 로그아웃 시 사용자 레코드를 저장하고 장바구니는 버린다.
 */
@Component
public class LoginMenu {

    private final AccountService accountService;
    private final CustomerMenu customerMenu;
    private final AdminMenu adminMenu;
    private final ConsoleExceptionHandler exceptionHandler;

    public LoginMenu(AccountService accountService, CustomerMenu customerMenu, AdminMenu adminMenu,
                     ConsoleExceptionHandler exceptionHandler) {
        this.accountService = accountService;
        this.customerMenu = customerMenu;
        this.adminMenu = adminMenu;
        this.exceptionHandler = exceptionHandler;
    }

    /**
     * 종료를 선택할 때까지 반복
     */
    public void show(ConsoleIO io) {
        while (true) {
            io.heading("MMOSS Supermarket");
            io.println("1. Login");
            io.println("0. Exit");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> login(io);
                case ConsoleIO.BACK -> {
                    io.println("Goodbye.");
                    return;
                }
                default -> io.invalidChoice();
            }
        }
    }

    private void login(ConsoleIO io) {
        String email = io.readRequired("Email");
        String password = io.readRequired("Password");
        User user;
        try {
            user = accountService.authenticate(email, password);
        } catch (AuthenticationFailedException e) {
            io.println("  ! " + e.getMessage());
            return;
        }

        ShopSession session = new ShopSession(user);
        if (user.isAdmin()) {
            adminMenu.show(io, session);
        } else {
            customerMenu.show(io, session);
        }
        if (exceptionHandler.run(io, () -> accountService.logout(user))) {
            io.println("Logged out.");
        }
    }
}

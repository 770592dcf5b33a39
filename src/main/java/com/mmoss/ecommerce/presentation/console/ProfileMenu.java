package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.order.OrderHistoryService;
import com.mmoss.ecommerce.application.user.AccountService;
import com.mmoss.ecommerce.application.user.MembershipService;
import com.mmoss.ecommerce.application.user.dto.MembershipReceipt;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.MembershipHistoryEntry;
import com.mmoss.ecommerce.domain.user.MembershipStatus;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * ProfileMenu - 프로필, 잔액, VIP 회원권, 주문 내역
 */
@Component
public class ProfileMenu {

    private static final DateTimeFormatter HISTORY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final AccountService accountService;
    private final MembershipService membershipService;
    private final OrderHistoryService orderHistoryService;
    private final ConsoleExceptionHandler exceptionHandler;

    public ProfileMenu(AccountService accountService, MembershipService membershipService,
                       OrderHistoryService orderHistoryService, ConsoleExceptionHandler exceptionHandler) {
        this.accountService = accountService;
        this.membershipService = membershipService;
        this.orderHistoryService = orderHistoryService;
        this.exceptionHandler = exceptionHandler;
    }

    public MenuResult show(ConsoleIO io, ShopSession session) {
        User customer = session.getUser();
        while (true) {
            io.heading("Profile & Membership");
            io.println("1. View profile");
            io.println("2. Top up funds");
            io.println("3. Buy or renew VIP membership");
            io.println("4. Cancel VIP membership");
            io.println("5. Membership history");
            io.println("6. Order history");
            io.println("7. Order details");
            io.println("8. Update contact details");
            io.println("9. Change password");
            io.println("0. Back   M. Main menu");
            String choice = io.readChoice();
            switch (choice) {
                case "1" -> printProfile(io, customer);
                case "2" -> {
                    Money amount = io.readMoney("Top-up amount");
                    exceptionHandler.run(io, () -> io.println(
                            "New balance: " + accountService.topUp(customer, amount).format()));
                }
                case "3" -> buyMembership(io, customer);
                case "4" -> cancelMembership(io, customer);
                case "5" -> printHistory(io, membershipService.history(customer));
                case "6" -> ConsoleViews.printOrders(io, orderHistoryService.findMyOrders(customer), false);
                case "7" -> {
                    String orderId = io.readRequired("Order id");
                    exceptionHandler.run(io, () -> ConsoleViews.printOrderDetail(
                            io, orderHistoryService.findOrder(customer, orderId)));
                }
                case "8" -> updateContact(io, customer);
                case "9" -> {
                    String current = io.readRequired("Current password");
                    String next = io.readRequired("New password (8+ characters, one uppercase letter and one digit)");
                    if (exceptionHandler.run(io, () -> accountService.changePassword(customer, current, next))) {
                        io.println("Password changed.");
                    }
                }
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

    private void printProfile(ConsoleIO io, User customer) {
        MembershipStatus status = membershipService.status(customer);
        io.println("Name:     " + customer.getFullName());
        io.println("Email:    " + customer.getEmail());
        io.println("Mobile:   " + (customer.getMobile() == null ? "-" : customer.getMobile()));
        io.println("Address:  " + (customer.hasAddress() ? customer.getAddress() : "-"));
        io.println("Student:  " + (customer.isStudent() ? "Yes" : "No"));
        io.println("Funds:    " + customer.getFunds().format());
        String vip = status.getDisplayName();
        if (status == MembershipStatus.ACTIVE) {
            vip += " (expires " + customer.getVipMembership().getExpiryDate() + ", "
                    + membershipService.daysRemaining(customer) + " days left)";
        } else if (status == MembershipStatus.EXPIRED) {
            vip += " (expired " + customer.getVipMembership().getExpiryDate() + ")";
        }
        io.println("VIP:      " + vip);
    }

    private void buyMembership(ConsoleIO io, User customer) {
        int years = io.readInt("Years", 1, 10);
        Money cost = membershipService.quotePrice(years);
        if (!io.confirm("Pay " + cost.format() + " for " + years + " year(s) of VIP?")) {
            return;
        }
        exceptionHandler.run(io, () -> {
            MembershipReceipt receipt = membershipService.purchase(customer, years);
            io.println("VIP " + receipt.getAction().name().toLowerCase() + " complete. Expires "
                    + receipt.getExpiryDate() + ", remaining funds " + receipt.getRemainingFunds().format() + ".");
        });
    }

    private void cancelMembership(ConsoleIO io, User customer) {
        if (!io.confirm("Cancel your VIP membership? No refund is given")) {
            return;
        }
        if (exceptionHandler.run(io, () -> membershipService.cancel(customer))) {
            io.println("VIP membership cancelled.");
        }
    }

    private void printHistory(ConsoleIO io, List<MembershipHistoryEntry> history) {
        if (history.isEmpty()) {
            io.println("No membership activity.");
            return;
        }
        List<List<String>> rows = new ArrayList<>();
        for (MembershipHistoryEntry entry : history) {
            rows.add(List.of(entry.getOccurredAt().format(HISTORY_TIME), entry.getAction().name(),
                    String.valueOf(entry.getYears()), entry.getAmount().format(),
                    entry.getNotes() == null ? "" : entry.getNotes()));
        }
        io.println(TableFormatter.format(List.of("When", "Action", "Years", "Amount", "Notes"), rows));
    }

    private void updateContact(ConsoleIO io, User customer) {
        String mobile = io.prompt("Mobile (blank to keep)");
        String address = io.prompt("Address (blank to keep)");
        if (mobile.isEmpty() && address.isEmpty()) {
            io.println("Nothing changed.");
            return;
        }
        if (exceptionHandler.run(io, () -> accountService.updateContact(customer,
                mobile.isEmpty() ? null : mobile, address.isEmpty() ? null : address))) {
            io.println("Contact details updated.");
        }
    }
}

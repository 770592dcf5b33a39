package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.application.promotion.PromotionService;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.promotion.Promotion;
import com.mmoss.ecommerce.domain.user.User;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 프로모션 안내 (전체 목록과 수령 방식별 사용 가능 여부)
 */
@Component
public class PromotionMenu {

    private final PromotionService promotionService;

    public PromotionMenu(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    public MenuResult show(ConsoleIO io, ShopSession session) {
        User customer = session.getUser();
        List<Promotion> forDelivery = promotionService.eligibleFor(customer, FulfilmentMode.DELIVERY);
        List<Promotion> forPickup = promotionService.eligibleFor(customer, FulfilmentMode.PICKUP);

        io.heading("Promotions");
        List<List<String>> rows = new ArrayList<>();
        for (Promotion promotion : promotionService.listAll()) {
            rows.add(List.of(promotion.getCode(), promotion.getPercentOff() + "%", promotion.getDescription(),
                    promotion.describeEligibility(),
                    forDelivery.contains(promotion) ? "Yes" : "No",
                    forPickup.contains(promotion) ? "Yes" : "No"));
        }
        io.println(TableFormatter.format(
                List.of("Code", "Off", "Description", "Who", "Delivery", "Pickup"), rows));
        if (customer.isStudent()) {
            io.println("Students already get a pickup discount, promotion codes do not stack with it.");
        }
        io.prompt("Press Enter to go back");
        return MenuResult.BACK;
    }
}

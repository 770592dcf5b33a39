package com.mmoss.ecommerce.domain.promotion;

import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.promotion.rule.AllOfRule;
import com.mmoss.ecommerce.domain.promotion.rule.FirstPickupOrderRule;
import com.mmoss.ecommerce.domain.promotion.rule.FulfilmentRestrictedRule;
import com.mmoss.ecommerce.domain.promotion.rule.StaffOnlyRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PromotionCatalog - 프로모션 코드 목록 (Domain Service)
 *
 * 책임:
 * - 코드로 프로모션 조회 (대소문자 무시)
 * - 프로모션 추가 등록
 * - 주어진 상황에서 고객이 사용할 수 있는 프로모션 목록
 *
 * 기본 코드:
 * - NEWMONASH20: 첫 매장 픽업 주문 20% 할인
 * - STAFF5: 교직원 5% 할인
 */
public class PromotionCatalog {

    public static final String NEW_MONASH_20 = "NEWMONASH20";
    public static final String STAFF_5 = "STAFF5";

    static final String MSG_UNKNOWN_CODE = "Invalid promotion code";

    private final Map<String, Promotion> promotions = new LinkedHashMap<>();

    public static PromotionCatalog withDefaults() {
        PromotionCatalog catalog = new PromotionCatalog();
        catalog.register(new Promotion(NEW_MONASH_20, "20% off your first store pickup order", 20,
                AllOfRule.of(new FulfilmentRestrictedRule(FulfilmentMode.PICKUP), new FirstPickupOrderRule())));
        catalog.register(new Promotion(STAFF_5, "5% off for Monash staff", 5, new StaffOnlyRule()));
        return catalog;
    }

    /**
     * @return 등록 성공 여부 (이미 존재하는 코드면 false)
     */
    public boolean register(Promotion promotion) {
        if (promotions.containsKey(promotion.getCode())) {
            return false;
        }
        promotions.put(promotion.getCode(), promotion);
        return true;
    }

    public Optional<Promotion> find(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(promotions.get(Promotion.normalizeCode(code)));
    }

    /**
     * @throws InvalidPromoException 존재하지 않는 코드
     */
    public Promotion resolve(String code) {
        return find(code).orElseThrow(() -> new InvalidPromoException(Promotion.normalizeCode(code), MSG_UNKNOWN_CODE));
    }

    public List<Promotion> all() {
        return new ArrayList<>(promotions.values());
    }

    public List<Promotion> eligibleFor(EligibilityContext context) {
        return promotions.values().stream()
                .filter(p -> p.isEligible(context))
                .collect(Collectors.toList());
    }
}

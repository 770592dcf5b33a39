package com.mmoss.ecommerce.domain.promotion;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.promotion.rule.EligibilityRule;
import lombok.Getter;

import java.util.Locale;
import java.util.Objects;

/**
 * Promotion - 백분율 할인 프로모션 코드
 *
 * 핵심 비즈니스 규칙:
 * - 코드는 대문자로 저장하며 대소문자 무시 조회
 * - 할인율은 1~100
 * - 학생 픽업 할인과 중복 적용 불가
 * - 할인액은 소계를 넘지 않음
 */
@Getter
public class Promotion {

    static final String MSG_STACKING = "Cannot be combined with the student pickup discount";

    private final String code;
    private final String description;
    private final int percentOff;
    private final EligibilityRule rule;

    public Promotion(String code, String description, int percentOff, EligibilityRule rule) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Promotion code is required");
        }
        if (percentOff < 1 || percentOff > 100) {
            throw new IllegalArgumentException("Percent off must be between 1 and 100: " + percentOff);
        }
        this.code = normalizeCode(code);
        this.description = description;
        this.percentOff = percentOff;
        this.rule = Objects.requireNonNull(rule, "rule은 null이 될 수 없습니다");
    }

    /**
     * 자격 검증
     *
     * @throws InvalidPromoException 학생 픽업 할인과 중복이거나 자격 조건 불충족
     */
    public void checkEligibility(EligibilityContext context) {
        if (context.isStudentPickupDiscount()) {
            throw new InvalidPromoException(code, MSG_STACKING);
        }
        rule.rejectionReason(context).ifPresent(reason -> {
            throw new InvalidPromoException(code, reason);
        });
    }

    public boolean isEligible(EligibilityContext context) {
        return !context.isStudentPickupDiscount() && rule.isSatisfiedBy(context);
    }

    /**
     * 할인액 = 소계 × 할인율 (소계 상한)
     */
    public Money discountFor(Money subtotal) {
        return subtotal.percentage(percentOff).min(subtotal);
    }

    public String describeEligibility() {
        return rule.describe();
    }

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}

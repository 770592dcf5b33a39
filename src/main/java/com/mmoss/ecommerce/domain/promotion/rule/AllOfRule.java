package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 하위 조건을 모두 충족해야 적용 (첫 번째 부적격 사유 반환)
 */
public final class AllOfRule implements EligibilityRule {

    private final List<EligibilityRule> rules;

    public AllOfRule(List<EligibilityRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public static AllOfRule of(EligibilityRule... rules) {
        return new AllOfRule(List.of(rules));
    }

    @Override
    public Optional<String> rejectionReason(EligibilityContext context) {
        for (EligibilityRule rule : rules) {
            Optional<String> reason = rule.rejectionReason(context);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return rules.stream().map(EligibilityRule::describe).collect(Collectors.joining(", "));
    }
}

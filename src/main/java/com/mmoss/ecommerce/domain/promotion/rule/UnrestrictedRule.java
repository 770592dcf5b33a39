package com.mmoss.ecommerce.domain.promotion.rule;

import com.mmoss.ecommerce.domain.promotion.EligibilityContext;

import java.util.Optional;

public final class UnrestrictedRule implements EligibilityRule {

    @Override
    public Optional<String> rejectionReason(EligibilityContext context) {
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "Any order";
    }
}

package com.mmoss.ecommerce.domain.order;

import java.util.Locale;

/**
 * 주문 수령 방식
 */
public enum FulfilmentMode {
    DELIVERY("Home delivery"),
    PICKUP("Store pickup");

    private final String displayName;

    FulfilmentMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static FulfilmentMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fulfilment mode is required");
        }
        return FulfilmentMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

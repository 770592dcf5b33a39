package com.mmoss.ecommerce.domain.user;

import java.util.Locale;

/**
 * 사용자 역할
 */
public enum Role {
    CUSTOMER("Customer"),
    ADMIN("Administrator");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * CSV 값으로부터 역할 변환 (대소문자 무시)
     *
     * @throws IllegalArgumentException 알 수 없는 역할
     */
    public static Role fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role is required");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

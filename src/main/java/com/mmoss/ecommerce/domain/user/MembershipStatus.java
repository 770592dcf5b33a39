package com.mmoss.ecommerce.domain.user;

/**
 * VIP 회원권 표시 상태 (저장하지 않고 날짜로 계산)
 */
public enum MembershipStatus {
    NONE("No membership"),
    ACTIVE("Active"),
    EXPIRED("Expired"),
    CANCELLED("Cancelled");

    private final String displayName;

    MembershipStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

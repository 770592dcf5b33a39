package com.mmoss.ecommerce.domain.user;

/**
 * 회원권 이력 유형
 */
public enum MembershipAction {
    BUY,
    RENEW,
    CANCEL
}

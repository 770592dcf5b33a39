package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 회원권 거래 이력 (추가 전용)
 */
@Getter
@Builder
@AllArgsConstructor
public class MembershipHistoryEntry {

    private final String email;
    private final MembershipAction action;
    private final int years;
    private final Money amount;
    private final LocalDateTime occurredAt;
    private final String notes;
}

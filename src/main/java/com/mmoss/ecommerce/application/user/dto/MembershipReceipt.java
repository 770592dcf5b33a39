package com.mmoss.ecommerce.application.user.dto;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.MembershipAction;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * 회원권 구매/갱신/해지 결과
 */
@Getter
@Builder
public class MembershipReceipt {

    private final MembershipAction action;
    private final int years;
    private final Money amountCharged;
    private final LocalDate expiryDate;
    private final Money remainingFunds;
}

package com.mmoss.ecommerce.domain.user;

import lombok.Getter;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * VipMembership - VIP 회원권 값 객체
 *
 * 책임:
 * - 만료일, 누적 구매 연수, 해지 여부 보관
 * - 활성 여부 판정 (만료 상태는 저장하지 않고 날짜로 계산)
 *
 * 핵심 비즈니스 규칙:
 * - 활성: 만료일이 있고, 오늘 이후(오늘 포함)이며, 해지되지 않음
 * - 신규 구매(비활성 상태): 만료일 = 오늘 + N년
 * - 갱신(활성 상태): 만료일 = 기존 만료일 + N년
 * - 해지: 환불 없이 만료일 즉시 제거, 해지 플래그 설정
 */
@Getter
public final class VipMembership {

    private static final VipMembership NONE = new VipMembership(null, 0, false);

    private final LocalDate expiryDate;
    private final int years;
    private final boolean cancelled;

    public VipMembership(LocalDate expiryDate, int years, boolean cancelled) {
        if (years < 0) {
            throw new IllegalArgumentException("Membership years cannot be negative: " + years);
        }
        this.expiryDate = expiryDate;
        this.years = years;
        this.cancelled = cancelled;
    }

    public static VipMembership none() {
        return NONE;
    }

    public boolean isActive(LocalDate today) {
        return expiryDate != null && !expiryDate.isBefore(today) && !cancelled;
    }

    /**
     * 만료일까지 남은 일수 (비활성이면 0, 만료일 당일도 0)
     */
    public long daysRemaining(LocalDate today) {
        if (!isActive(today)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(today, expiryDate);
    }

    public MembershipStatus statusOn(LocalDate today) {
        if (cancelled) {
            return MembershipStatus.CANCELLED;
        }
        if (expiryDate == null) {
            return MembershipStatus.NONE;
        }
        return isActive(today) ? MembershipStatus.ACTIVE : MembershipStatus.EXPIRED;
    }

    /**
     * 구매 또는 갱신 결과 회원권 생성
     *
     * @param additionalYears 1 이상
     * @param today 기준일
     */
    public VipMembership extend(int additionalYears, LocalDate today) {
        if (additionalYears < 1) {
            throw new IllegalArgumentException("Membership years must be at least 1: " + additionalYears);
        }
        LocalDate base = isActive(today) ? expiryDate : today;
        return new VipMembership(base.plusYears(additionalYears), years + additionalYears, false);
    }

    public VipMembership cancel() {
        return new VipMembership(null, years, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VipMembership)) return false;
        VipMembership that = (VipMembership) o;
        return years == that.years && cancelled == that.cancelled && Objects.equals(expiryDate, that.expiryDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expiryDate, years, cancelled);
    }

    @Override
    public String toString() {
        return "VipMembership(expiry=" + expiryDate + ", years=" + years + ", cancelled=" + cancelled + ")";
    }
}

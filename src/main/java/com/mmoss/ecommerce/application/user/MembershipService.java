package com.mmoss.ecommerce.application.user;

import com.mmoss.ecommerce.application.common.AccessGuard;
import com.mmoss.ecommerce.application.user.dto.MembershipReceipt;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.InvalidAccountUpdateException;
import com.mmoss.ecommerce.domain.user.MembershipAction;
import com.mmoss.ecommerce.domain.user.MembershipHistoryEntry;
import com.mmoss.ecommerce.domain.user.MembershipHistoryRepository;
import com.mmoss.ecommerce.domain.user.MembershipNotActiveException;
import com.mmoss.ecommerce.domain.user.MembershipStatus;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.UserRepository;
import com.mmoss.ecommerce.domain.user.VipMembership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * MembershipService - VIP 회원권 수명 주기 (Application 계층)
 *
 * 책임:
 * - 구매/갱신: 연회비 × 연수를 잔액에서 차감
 * - 해지: 환불 없이 즉시 종료
 * - 모든 거래를 회원권 이력에 기록
 *
 * 핵심 비즈니스 규칙:
 * - 활성 상태에서 구매하면 갱신(RENEW)으로 기존 만료일부터 연장
 * - 비활성 상태(없음/만료/해지)에서 구매하면 신규(BUY)로 오늘부터 시작
 * - 해지는 활성 회원권에만 가능
 *
 * 처리 순서: 검증 → 잔액 차감 및 회원권 변경 → users.csv 저장 → 이력 추가
 * 이력 추가 실패는 회원권 변경을 취소하지 않는다 (로그만 남김).
 */
@Service
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final UserRepository userRepository;
    private final MembershipHistoryRepository membershipHistoryRepository;
    private final ShopPolicy shopPolicy;
    private final Clock clock;

    public MembershipService(UserRepository userRepository,
                             MembershipHistoryRepository membershipHistoryRepository,
                             ShopPolicy shopPolicy,
                             Clock clock) {
        this.userRepository = userRepository;
        this.membershipHistoryRepository = membershipHistoryRepository;
        this.shopPolicy = shopPolicy;
        this.clock = clock;
    }

    public Money quotePrice(int years) {
        if (years < 1) {
            throw InvalidAccountUpdateException.membershipYears(years);
        }
        return shopPolicy.getVipCostPerYear().multiply(years);
    }

    public MembershipStatus status(User customer) {
        return customer.getVipMembership().statusOn(LocalDate.now(clock));
    }

    public long daysRemaining(User customer) {
        return customer.getVipMembership().daysRemaining(LocalDate.now(clock));
    }

    /**
     * 회원권 구매 또는 갱신
     *
     * @throws InvalidAccountUpdateException years < 1
     * @throws com.mmoss.ecommerce.domain.user.InsufficientFundsException 잔액 부족
     */
    public MembershipReceipt purchase(User customer, int years) {
        AccessGuard.requireCustomer(customer);
        Money cost = quotePrice(years);
        LocalDate today = LocalDate.now(clock);
        VipMembership previous = customer.getVipMembership();
        MembershipAction action = previous.isActive(today) ? MembershipAction.RENEW : MembershipAction.BUY;

        customer.debit(cost);
        VipMembership next = previous.extend(years, today);
        customer.applyMembership(next);
        try {
            userRepository.saveAll();
        } catch (PersistenceException e) {
            customer.applyMembership(previous);
            customer.credit(cost);
            throw e;
        }

        log.info("[MembershipService] 회원권 {}: email={}, years={}, cost={}, expiry={}",
                action, customer.getEmail(), years, cost.toPlainString(), next.getExpiryDate());
        recordHistory(customer, action, years, cost, "expires " + next.getExpiryDate());

        return MembershipReceipt.builder()
                .action(action)
                .years(years)
                .amountCharged(cost)
                .expiryDate(next.getExpiryDate())
                .remainingFunds(customer.getFunds())
                .build();
    }

    /**
     * 회원권 해지 (환불 없음)
     *
     * @throws MembershipNotActiveException 활성 회원권이 없는 경우
     */
    public MembershipReceipt cancel(User customer) {
        AccessGuard.requireCustomer(customer);
        VipMembership previous = customer.getVipMembership();
        if (!previous.isActive(LocalDate.now(clock))) {
            throw new MembershipNotActiveException(customer.getEmail());
        }

        customer.applyMembership(previous.cancel());
        try {
            userRepository.saveAll();
        } catch (PersistenceException e) {
            customer.applyMembership(previous);
            throw e;
        }

        log.info("[MembershipService] 회원권 해지: email={}, previousExpiry={}",
                customer.getEmail(), previous.getExpiryDate());
        recordHistory(customer, MembershipAction.CANCEL, 0, Money.ZERO,
                "non-refundable, was due to expire " + previous.getExpiryDate());

        return MembershipReceipt.builder()
                .action(MembershipAction.CANCEL)
                .years(0)
                .amountCharged(Money.ZERO)
                .expiryDate(null)
                .remainingFunds(customer.getFunds())
                .build();
    }

    public List<MembershipHistoryEntry> history(User customer) {
        return membershipHistoryRepository.findByEmail(customer.getEmail());
    }

    private void recordHistory(User customer, MembershipAction action, int years, Money amount, String notes) {
        try {
            membershipHistoryRepository.append(MembershipHistoryEntry.builder()
                    .email(customer.getEmail())
                    .action(action)
                    .years(years)
                    .amount(amount)
                    .occurredAt(LocalDateTime.now(clock))
                    .notes(notes)
                    .build());
        } catch (PersistenceException e) {
            log.error("[MembershipService] 회원권 이력 기록 실패: email={}, action={}", customer.getEmail(), action, e);
        }
    }
}

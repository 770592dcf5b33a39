package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Locale;

/**
 * User 도메인 엔티티
 *
 * 책임:
 * - 고객/관리자 계정 정보 관리
 * - 잔액 충전/차감
 * - VIP 회원권 상태 보관
 * - 연락처 변경
 *
 * 핵심 비즈니스 규칙:
 * - 이메일은 소문자, 공백 제거 후 저장 (고유 키)
 * - 잔액은 0 이상 (Money가 음수를 허용하지 않음)
 * - 학생 여부는 계정 생성 시 고정
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private String email;
    private String passwordHash;
    private Role role;
    private String firstName;
    private String lastName;
    private String mobile;
    private String address;
    private boolean student;

    @Builder.Default
    private Money funds = Money.ZERO;

    @Builder.Default
    private VipMembership vipMembership = VipMembership.none();

    /**
     * 고객 계정 생성 팩토리 메서드
     *
     * @throws IllegalArgumentException 이메일 또는 비밀번호 해시 누락
     */
    public static User createCustomer(String email, String passwordHash, String firstName, String lastName,
                                      boolean student, Money initialFunds) {
        validateIdentity(email, passwordHash);
        return User.builder()
                .email(normalizeEmail(email))
                .passwordHash(passwordHash)
                .role(Role.CUSTOMER)
                .firstName(firstName)
                .lastName(lastName)
                .student(student)
                .funds(initialFunds == null ? Money.ZERO : initialFunds)
                .vipMembership(VipMembership.none())
                .build();
    }

    public static User createAdmin(String email, String passwordHash, String firstName, String lastName) {
        validateIdentity(email, passwordHash);
        return User.builder()
                .email(normalizeEmail(email))
                .passwordHash(passwordHash)
                .role(Role.ADMIN)
                .firstName(firstName)
                .lastName(lastName)
                .student(false)
                .funds(Money.ZERO)
                .vipMembership(VipMembership.none())
                .build();
    }

    // ========== 역할 ==========

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isCustomer() {
        return role == Role.CUSTOMER;
    }

    /**
     * 교직원 여부: 학생이 아니고 이메일 도메인이 교직원 도메인과 일치
     */
    public boolean isStaff(String staffEmailDomain) {
        return !student && staffEmailDomain != null
                && email.endsWith("@" + staffEmailDomain.toLowerCase(Locale.ROOT));
    }

    public String getFullName() {
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        return (first + " " + last).trim();
    }

    // ========== 잔액 ==========

    /**
     * 잔액 충전
     */
    public void credit(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new IllegalArgumentException("Top-up amount must be greater than 0");
        }
        this.funds = this.funds.add(amount);
    }

    /**
     * 잔액 차감
     *
     * @throws InsufficientFundsException 잔액이 부족한 경우 (부분 결제 없음)
     */
    public void debit(Money amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (funds.isLessThan(amount)) {
            throw new InsufficientFundsException(amount, funds);
        }
        this.funds = this.funds.subtract(amount);
    }

    public boolean canAfford(Money amount) {
        return funds.isGreaterThanOrEqual(amount);
    }

    // ========== VIP ==========

    public boolean isVipActive(LocalDate today) {
        return vipMembership != null && vipMembership.isActive(today);
    }

    public void applyMembership(VipMembership membership) {
        if (membership == null) {
            throw new IllegalArgumentException("Membership is required");
        }
        this.vipMembership = membership;
    }

    // ========== 계정 정보 ==========

    /**
     * 연락처 변경 (null 값은 기존 값 유지)
     *
     * @throws IllegalArgumentException 형식 위반
     */
    public void updateContact(String newMobile, String newAddress) {
        if (newMobile != null) {
            String trimmed = newMobile.trim();
            if (!UserConstants.MOBILE_PATTERN.matcher(trimmed).matches()) {
                throw new IllegalArgumentException(UserConstants.MSG_INVALID_MOBILE);
            }
            this.mobile = trimmed;
        }
        if (newAddress != null) {
            if (newAddress.isBlank()) {
                throw new IllegalArgumentException(UserConstants.MSG_BLANK_ADDRESS);
            }
            this.address = newAddress.trim();
        }
    }

    /**
     * 저장 실패 보상용: 검증 없이 이전 연락처로 되돌림
     */
    public void restoreContact(String previousMobile, String previousAddress) {
        this.mobile = previousMobile;
        this.address = previousAddress;
    }

    public void changePasswordHash(String newPasswordHash) {
        if (newPasswordHash == null || newPasswordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required");
        }
        this.passwordHash = newPasswordHash;
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static void validateIdentity(String email, String passwordHash) {
        if (email == null || email.isBlank() || !email.contains("@")) {
            throw new IllegalArgumentException("A valid email is required");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required");
        }
    }
}

package com.mmoss.ecommerce.application.user;

import com.mmoss.ecommerce.application.common.AccessGuard;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.AuthenticationFailedException;
import com.mmoss.ecommerce.domain.user.InvalidAccountUpdateException;
import com.mmoss.ecommerce.domain.user.PasswordHasher;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.UserConstants;
import com.mmoss.ecommerce.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * AccountService - 인증 및 계정 관리 (Application 계층)
 *
 * 책임:
 * - 로그인 (SHA-256 해시 비교)
 * - 로그아웃 시 사용자 레코드 저장
 * - 잔액 충전 (1회 한도)
 * - 연락처 변경, 비밀번호 변경
 *
 * 비즈니스 규칙:
 * - 충전 금액: 0 초과, 한도 이하
 * - 휴대폰: 숫자, 공백, 하이픈만
 * - 새 비밀번호: 8자 이상, 대문자와 숫자 각 1개 이상, 현재 비밀번호 확인 필수
 * - 저장 실패 시 메모리 변경을 되돌린다
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final ShopPolicy shopPolicy;

    public AccountService(UserRepository userRepository, PasswordHasher passwordHasher, ShopPolicy shopPolicy) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.shopPolicy = shopPolicy;
    }

    /**
     * @throws AuthenticationFailedException 이메일이 없거나 비밀번호 불일치
     */
    public User authenticate(String email, String password) {
        User user = userRepository.findByKey(email)
                .filter(u -> passwordHasher.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("[AccountService] 로그인 실패: email={}", User.normalizeEmail(email));
                    return new AuthenticationFailedException();
                });
        log.info("[AccountService] 로그인 성공: email={}, role={}", user.getEmail(), user.getRole());
        return user;
    }

    public void logout(User user) {
        userRepository.upsert(user);
        userRepository.saveAll();
        log.info("[AccountService] 로그아웃: email={}", user.getEmail());
    }

    /**
     * 잔액 충전
     *
     * @return 충전 후 잔액
     * @throws InvalidAccountUpdateException 금액이 0 이하이거나 한도 초과
     */
    public Money topUp(User customer, Money amount) {
        AccessGuard.requireCustomer(customer);
        if (amount == null || !amount.isPositive()) {
            throw InvalidAccountUpdateException.topUp("Amount must be greater than $0.00");
        }
        if (amount.isGreaterThan(shopPolicy.getMaxTopUp())) {
            throw InvalidAccountUpdateException.topUp("Maximum top-up is " + shopPolicy.getMaxTopUp().format());
        }

        customer.credit(amount);
        try {
            userRepository.saveAll();
        } catch (PersistenceException e) {
            customer.debit(amount);
            throw e;
        }
        log.info("[AccountService] 잔액 충전: email={}, amount={}, funds={}",
                customer.getEmail(), amount.toPlainString(), customer.getFunds().toPlainString());
        return customer.getFunds();
    }

    /**
     * 연락처 변경 (null은 기존 값 유지)
     *
     * @throws InvalidAccountUpdateException 형식 위반
     */
    public void updateContact(User user, String mobile, String address) {
        String previousMobile = user.getMobile();
        String previousAddress = user.getAddress();
        try {
            user.updateContact(mobile, address);
        } catch (IllegalArgumentException e) {
            throw InvalidAccountUpdateException.contact(e.getMessage());
        }
        try {
            userRepository.saveAll();
        } catch (PersistenceException e) {
            user.restoreContact(previousMobile, previousAddress);
            throw e;
        }
        log.info("[AccountService] 연락처 변경: email={}", user.getEmail());
    }

    /**
     * @throws InvalidAccountUpdateException 현재 비밀번호 불일치 또는 새 비밀번호 강도 미달
     */
    public void changePassword(User user, String currentPassword, String newPassword) {
        if (!passwordHasher.matches(currentPassword, user.getPasswordHash())) {
            throw InvalidAccountUpdateException.password(UserConstants.MSG_WRONG_PASSWORD);
        }
        if (!passwordHasher.isStrong(newPassword)) {
            throw InvalidAccountUpdateException.password(UserConstants.MSG_WEAK_PASSWORD);
        }
        String previousHash = user.getPasswordHash();
        user.changePasswordHash(passwordHasher.hash(newPassword));
        try {
            userRepository.saveAll();
        } catch (PersistenceException e) {
            user.changePasswordHash(previousHash);
            throw e;
        }
        log.info("[AccountService] 비밀번호 변경: email={}", user.getEmail());
    }
}

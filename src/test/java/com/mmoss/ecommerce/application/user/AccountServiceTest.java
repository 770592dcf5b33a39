package com.mmoss.ecommerce.application.user;

import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.user.AuthenticationFailedException;
import com.mmoss.ecommerce.domain.user.InvalidAccountUpdateException;
import com.mmoss.ecommerce.domain.user.PasswordHasher;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.infrastructure.persistence.user.CsvUserRepository;
import com.mmoss.ecommerce.support.ShopTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AccountService 테스트
 * - 로그인 (이메일 대소문자 무시)
 * - 잔액 충전 한도
 * - 연락처/비밀번호 변경
 */
@DisplayName("AccountService 테스트")
class AccountServiceTest {

    private static final String PASSWORD = "Monash1234!";

    @TempDir
    Path dataDir;

    private ShopTestFixture fixture;
    private PasswordHasher passwordHasher;
    private AccountService accountService;
    private User shopper;

    @BeforeEach
    void setUp() {
        fixture = new ShopTestFixture(dataDir);
        passwordHasher = new PasswordHasher();
        accountService = new AccountService(fixture.userRepository, passwordHasher, fixture.policy);
        shopper = User.createCustomer("jo@example.com", passwordHasher.hash(PASSWORD),
                "Jo", "Shopper", false, Money.of("10.00"));
        fixture.userRepository.upsert(shopper);
        fixture.userRepository.saveAll();
    }

    private User reloadShopper() {
        return new CsvUserRepository(dataDir.resolve(CsvUserRepository.FILE_NAME), fixture.csvMapper)
                .findByKey("jo@example.com").orElseThrow();
    }

    // ========== 로그인 ==========

    @Test
    @DisplayName("로그인 - 이메일 대소문자 무시")
    void testAuthenticate_Success() {
        User user = accountService.authenticate(" JO@Example.com ", PASSWORD);

        assertSame(shopper, user);
    }

    @Test
    @DisplayName("로그인 실패 - 비밀번호 불일치, 없는 이메일")
    void testAuthenticate_Failure() {
        assertThrows(AuthenticationFailedException.class, () -> accountService.authenticate("jo@example.com", "wrong"));
        assertThrows(AuthenticationFailedException.class, () -> accountService.authenticate("nobody@example.com", PASSWORD));
    }

    // ========== 충전 ==========

    @Test
    @DisplayName("충전 - 잔액 증가 후 파일 저장")
    void testTopUp_Success() {
        Money funds = accountService.topUp(shopper, Money.of("1000.00"));

        assertEquals(Money.of("1010.00"), funds);
        assertEquals(Money.of("1010.00"), reloadShopper().getFunds());
    }

    @Test
    @DisplayName("충전 실패 - 0원 또는 한도 초과")
    void testTopUp_Invalid() {
        assertThrows(InvalidAccountUpdateException.class, () -> accountService.topUp(shopper, Money.ZERO));
        assertThrows(InvalidAccountUpdateException.class, () -> accountService.topUp(shopper, Money.of("1000.01")));
        assertEquals(Money.of("10.00"), shopper.getFunds());
    }

    // ========== 연락처 / 비밀번호 ==========

    @Test
    @DisplayName("연락처 변경 - 저장 후 다시 읽어도 유지")
    void testUpdateContact_Success() {
        accountService.updateContact(shopper, "0412 345 678", "3 New Rd, Caulfield VIC 3145");

        User reloaded = reloadShopper();
        assertEquals("0412 345 678", reloaded.getMobile());
        assertEquals("3 New Rd, Caulfield VIC 3145", reloaded.getAddress());
    }

    @Test
    @DisplayName("연락처 변경 실패 - 잘못된 휴대폰 번호")
    void testUpdateContact_Invalid() {
        InvalidAccountUpdateException exception = assertThrows(InvalidAccountUpdateException.class,
                () -> accountService.updateContact(shopper, "call me", null));

        assertTrue(exception.getMessage().contains("digits"));
    }

    @Test
    @DisplayName("비밀번호 변경 - 새 비밀번호로 로그인")
    void testChangePassword_Success() {
        accountService.changePassword(shopper, PASSWORD, "Stronger2026");

        assertSame(shopper, accountService.authenticate("jo@example.com", "Stronger2026"));
        assertThrows(AuthenticationFailedException.class, () -> accountService.authenticate("jo@example.com", PASSWORD));
    }

    @Test
    @DisplayName("비밀번호 변경 실패 - 현재 비밀번호 불일치, 약한 비밀번호")
    void testChangePassword_Rejected() {
        assertThrows(InvalidAccountUpdateException.class,
                () -> accountService.changePassword(shopper, "wrong", "Stronger2026"));
        assertThrows(InvalidAccountUpdateException.class,
                () -> accountService.changePassword(shopper, PASSWORD, "weakpass"));
        assertSame(shopper, accountService.authenticate("jo@example.com", PASSWORD));
    }
}

package com.mmoss.ecommerce;

import com.mmoss.ecommerce.application.order.CheckoutService;
import com.mmoss.ecommerce.common.exception.StartupFailureException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.user.UserRepository;
import com.mmoss.ecommerce.infrastructure.persistence.membership.CsvMembershipHistoryRepository;
import com.mmoss.ecommerce.infrastructure.persistence.order.CsvOrderRepository;
import com.mmoss.ecommerce.infrastructure.persistence.product.CsvProductRepository;
import com.mmoss.ecommerce.infrastructure.persistence.store.CsvStoreRepository;
import com.mmoss.ecommerce.infrastructure.persistence.user.CsvUserRepository;
import com.mmoss.ecommerce.presentation.console.ConsoleRunner;
import com.mmoss.ecommerce.presentation.console.LoginMenu;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 애플리케이션 컨텍스트 통합 테스트
 * - 데이터 디렉터리 초기화 (임시 디렉터리)
 * - 콘솔 비활성화 시 ConsoleRunner 미등록
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("애플리케이션 컨텍스트 테스트")
class ECommerceApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private UserRepository userRepository;

    @Test
    @DisplayName("컨텍스트 로딩 - 서비스와 메뉴 빈 등록, 콘솔 러너 없음")
    void contextLoads() {
        assertNotNull(context.getBean(CheckoutService.class));
        assertNotNull(context.getBean(LoginMenu.class));
        assertTrue(context.getBeansOfType(ConsoleRunner.class).isEmpty());
    }

    @Test
    @DisplayName("CSV 저장소 빈 - 설정된 데이터 디렉터리 기준 생성자로 주입")
    void csvRepositoriesCreated() {
        assertNotNull(context.getBean(CsvProductRepository.class));
        assertNotNull(context.getBean(CsvUserRepository.class));
        assertNotNull(context.getBean(CsvStoreRepository.class));
        assertNotNull(context.getBean(CsvOrderRepository.class));
        assertNotNull(context.getBean(CsvMembershipHistoryRepository.class));
        assertFalse(context.getBean(CsvStoreRepository.class).loadAll().isEmpty());
    }

    @Test
    @DisplayName("시작 시 데이터 파일 준비 - 상품과 기본 계정 존재")
    void dataFilesInitialized() {
        assertTrue(productRepository.findByKey("P001").isPresent());
        assertTrue(userRepository.findByKey("student@student.monash.edu").isPresent());
        assertTrue(userRepository.findByKey("admin@monash.edu").isPresent());
    }

    @Test
    @DisplayName("시작 실패 원인 탐색 - 원인 체인에서 StartupFailureException 발견")
    void findStartupFailure() {
        StartupFailureException failure = new StartupFailureException("data dir", null);

        assertSame(failure, ECommerceApplication.findStartupFailure(new IllegalStateException("wrap", failure)));
        assertNull(ECommerceApplication.findStartupFailure(new IllegalStateException("other")));
    }
}

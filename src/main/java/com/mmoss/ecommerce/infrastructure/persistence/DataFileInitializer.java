package com.mmoss.ecommerce.infrastructure.persistence;

import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.common.exception.StartupFailureException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.store.StoreRepository;
import com.mmoss.ecommerce.domain.user.PasswordHasher;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.domain.user.UserRepository;
import com.mmoss.ecommerce.infrastructure.persistence.product.CsvProductRepository;
import com.mmoss.ecommerce.infrastructure.persistence.store.CsvStoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * DataFileInitializer - 시작 시 데이터 디렉터리와 시드 데이터 준비
 *
 * 책임:
 * - 데이터 디렉터리 생성
 * - 사용자 파일이 없거나 비어 있으면 테스트 계정 생성 (학생, 교직원, 관리자)
 * - 매장 파일이 없으면 기본 픽업 매장 생성
 * - 상품 파일이 없으면 클래스패스의 기본 카탈로그 복사
 * - 모든 저장소를 한 번 적재하여 파일 형식 오류를 시작 시점에 드러냄
 *
 * 실패 시 StartupFailureException으로 애플리케이션을 종료시킨다.
 */
@Component
@Order(1)
public class DataFileInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataFileInitializer.class);

    static final String SEED_PRODUCTS = "seed/products.csv";
    static final Money SEED_FUNDS = Money.of("1000.00");

    private final ShopPolicy shopPolicy;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final PasswordHasher passwordHasher;

    public DataFileInitializer(ShopPolicy shopPolicy,
                               UserRepository userRepository,
                               ProductRepository productRepository,
                               StoreRepository storeRepository,
                               PasswordHasher passwordHasher) {
        this.shopPolicy = shopPolicy;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.storeRepository = storeRepository;
        this.passwordHasher = passwordHasher;
    }

    @Override
    public void run(String... args) {
        initialize();
    }

    /**
     * @throws StartupFailureException 디렉터리/파일 준비 또는 적재 실패
     */
    public void initialize() {
        Path dataDir = Path.of(shopPolicy.getDataDir());
        log.info("[DataFileInitializer] 데이터 디렉터리 준비: dir={}", dataDir.toAbsolutePath());
        try {
            Files.createDirectories(dataDir);
            seedProducts(dataDir.resolve(CsvProductRepository.FILE_NAME));
            seedUsers();
            seedStores(dataDir.resolve(CsvStoreRepository.FILE_NAME));
        } catch (IOException | PersistenceException e) {
            throw new StartupFailureException(dataDir.toAbsolutePath().toString(), e);
        }
    }

    private void seedProducts(Path productsFile) throws IOException {
        if (!Files.exists(productsFile)) {
            try (InputStream in = new ClassPathResource(SEED_PRODUCTS).getInputStream()) {
                Files.copy(in, productsFile);
            }
            log.info("[DataFileInitializer] 기본 상품 카탈로그 생성: file={}", productsFile);
        }
        productRepository.loadAll();
    }

    private void seedUsers() {
        userRepository.loadAll();
        if (!userRepository.isEmpty()) {
            return;
        }
        User student = User.createCustomer("student@student.monash.edu", passwordHasher.hash("Monash1234!"),
                "Sam", "Student", true, SEED_FUNDS);
        student.updateContact("0400 000 001", "8 College Walk, Clayton VIC 3800");

        User staff = User.createCustomer("staff@" + shopPolicy.getStaffEmailDomain(), passwordHasher.hash("Monash1234!"),
                "Alex", "Staff", false, SEED_FUNDS);
        staff.updateContact("0400 000 002", "900 Dandenong Rd, Caulfield East VIC 3145");

        User admin = User.createAdmin("admin@" + shopPolicy.getStaffEmailDomain(), passwordHasher.hash("Admin1234!"),
                "Store", "Admin");

        userRepository.upsert(student);
        userRepository.upsert(staff);
        userRepository.upsert(admin);
        userRepository.saveAll();
        log.info("[DataFileInitializer] 테스트 계정 생성: count=3");
    }

    private void seedStores(Path storesFile) {
        if (!Files.exists(storesFile)) {
            storeRepository.loadAll();
            storeRepository.upsert(PickupStore.builder()
                    .storeId("S1").name("MMOSS Caulfield")
                    .address("900 Dandenong Rd, Caulfield East VIC 3145")
                    .phone("03 9903 0001").hours("Mon-Sun 8am-9pm")
                    .build());
            storeRepository.upsert(PickupStore.builder()
                    .storeId("S2").name("MMOSS Clayton")
                    .address("Wellington Rd, Clayton VIC 3800")
                    .phone("03 9905 0002").hours("Mon-Sun 7am-10pm")
                    .build());
            storeRepository.saveAll();
            log.info("[DataFileInitializer] 기본 픽업 매장 생성: file={}", storesFile);
        }
        storeRepository.loadAll();
    }
}

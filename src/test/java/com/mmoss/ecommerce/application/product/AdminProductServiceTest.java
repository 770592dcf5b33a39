package com.mmoss.ecommerce.application.product;

import com.mmoss.ecommerce.application.product.dto.ProductCommand;
import com.mmoss.ecommerce.common.exception.ApplicationException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.CategoryLimitExceededException;
import com.mmoss.ecommerce.domain.product.DuplicateProductException;
import com.mmoss.ecommerce.domain.product.InvalidProductException;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.infrastructure.persistence.product.CsvProductRepository;
import com.mmoss.ecommerce.support.ShopTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.mmoss.ecommerce.support.ShopTestFixture.MILK;
import static com.mmoss.ecommerce.support.ShopTestFixture.NOTEBOOK;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AdminProductService 테스트
 * - 추가 (중복, 검증, 카테고리 상한)
 * - 부분 수정
 * - 삭제
 * - 관리자 권한
 */
@DisplayName("AdminProductService 테스트")
class AdminProductServiceTest {

    @TempDir
    Path dataDir;

    private ShopTestFixture fixture;
    private AdminProductService adminProductService;
    private User admin;

    @BeforeEach
    void setUp() {
        fixture = new ShopTestFixture(dataDir).withCatalog(12);
        ShopPolicy policy = ShopPolicy.builder()
                .dataDir(dataDir.toString())
                .deliveryFee(Money.of("20.00"))
                .studentPickupDiscountPercent(5)
                .vipCostPerYear(Money.of("20.00"))
                .maxTopUp(Money.of("1000.00"))
                .staffEmailDomain("monash.edu")
                .maxCategories(3)
                .build();
        adminProductService = new AdminProductService(fixture.productRepository, policy);
        admin = fixture.addAdmin("admin@monash.edu");
    }

    private static ProductCommand.ProductCommandBuilder pen(String sku, String category) {
        return ProductCommand.builder()
                .sku(sku)
                .name("Gel Pen")
                .brand("Campus")
                .description("Blue ink")
                .category(category)
                .subcategory("Writing")
                .price(Money.of("2.50"))
                .memberPrice(Money.of("2.00"))
                .stock(30);
    }

    // ========== 추가 ==========

    @Test
    @DisplayName("추가 - 성공 후 파일에 저장")
    void testAddProduct_Success() {
        Product product = adminProductService.addProduct(admin, pen("p200", "Stationery").build());

        assertEquals("P200", product.getSku());
        CsvProductRepository reloaded = new CsvProductRepository(
                dataDir.resolve(CsvProductRepository.FILE_NAME), fixture.csvMapper);
        assertEquals("Gel Pen", reloaded.findByKey("P200").orElseThrow().getName());
    }

    @Test
    @DisplayName("추가 실패 - 중복 SKU (대소문자 무시)")
    void testAddProduct_Duplicate() {
        assertThrows(DuplicateProductException.class,
                () -> adminProductService.addProduct(admin, pen("p009", "Stationery").build()));
    }

    @Test
    @DisplayName("추가 실패 - VIP 가격이 정가 초과")
    void testAddProduct_Invalid() {
        InvalidProductException exception = assertThrows(InvalidProductException.class,
                () -> adminProductService.addProduct(admin,
                        pen("P201", "Stationery").memberPrice(Money.of("3.00")).build()));

        assertTrue(exception.getMessage().contains("Member price cannot exceed the regular price"));
        assertTrue(fixture.productRepository.findByKey("P201").isEmpty());
    }

    @Test
    @DisplayName("추가 실패 - 카테고리 상한 초과, 기존 카테고리는 허용")
    void testAddProduct_CategoryLimit() {
        // 기존: Stationery, Dairy (상한 3)
        adminProductService.addProduct(admin, pen("P300", "Bakery").build());

        assertThrows(CategoryLimitExceededException.class,
                () -> adminProductService.addProduct(admin, pen("P301", "Household").build()));
        assertDoesNotThrow(() -> adminProductService.addProduct(admin, pen("P302", "bakery").build()));
    }

    // ========== 수정 / 삭제 ==========

    @Test
    @DisplayName("수정 - 지정한 필드만 변경")
    void testEditProduct_Partial() {
        Product updated = adminProductService.editProduct(admin, NOTEBOOK, ProductCommand.builder()
                .price(Money.of("21.00"))
                .stock(5)
                .name(" ")
                .build());

        assertEquals(Money.of("21.00"), updated.getPrice());
        assertEquals(Money.of("17.99"), updated.getMemberPrice());
        assertEquals(5, updated.getStock());
        assertEquals("A4 Notebook", updated.getName());
    }

    @Test
    @DisplayName("수정 실패 - 없는 상품, 검증 실패 시 기존 값 유지")
    void testEditProduct_Failures() {
        assertThrows(ProductNotFoundException.class,
                () -> adminProductService.editProduct(admin, "P404", ProductCommand.builder().build()));
        assertThrows(InvalidProductException.class, () -> adminProductService.editProduct(admin, NOTEBOOK,
                ProductCommand.builder().memberPrice(Money.of("25.00")).build()));

        assertEquals(Money.of("17.99"), fixture.productRepository.findByKey(NOTEBOOK).orElseThrow().getMemberPrice());
    }

    @Test
    @DisplayName("삭제 - 성공, 없는 상품은 예외")
    void testDeleteProduct() {
        adminProductService.deleteProduct(admin, MILK);

        assertTrue(fixture.productRepository.findByKey(MILK).isEmpty());
        assertThrows(ProductNotFoundException.class, () -> adminProductService.deleteProduct(admin, MILK));
    }

    @Test
    @DisplayName("고객 계정은 관리 기능 사용 불가")
    void testCustomerDenied() {
        User shopper = fixture.addCustomer("jo@example.com", false, "0");

        assertThrows(ApplicationException.class, () -> adminProductService.deleteProduct(shopper, MILK));
        assertTrue(fixture.productRepository.findByKey(MILK).isPresent());
    }
}

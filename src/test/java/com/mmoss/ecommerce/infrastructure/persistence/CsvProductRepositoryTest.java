package com.mmoss.ecommerce.infrastructure.persistence;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.config.JacksonConfig;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import com.mmoss.ecommerce.infrastructure.persistence.product.CsvProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CsvProductRepository 테스트
 * - 헤더 기반 읽기 (열 순서 무관)
 * - 잘못된 행 건너뛰기
 * - 저장 후 다시 읽기
 * - 검색 조건과 정렬
 */
@DisplayName("CsvProductRepository 테스트")
class CsvProductRepositoryTest {

    private static final String HEADER =
            "sku,name,brand,description,category,subcategory,price,member_price,quantity,"
                    + "is_food,expiry_date,ingredients,storage,allergens\n";

    @TempDir
    Path dataDir;

    private Path file;
    private CsvMapper csvMapper;

    @BeforeEach
    void setUp() {
        file = dataDir.resolve(CsvProductRepository.FILE_NAME);
        csvMapper = JacksonConfig.createCsvMapper();
    }

    private CsvProductRepository repository() {
        return new CsvProductRepository(file, csvMapper);
    }

    @Test
    @DisplayName("읽기 - 파일이 없으면 빈 카탈로그")
    void testLoadAll_MissingFile() {
        assertTrue(repository().loadAll().isEmpty());
    }

    @Test
    @DisplayName("읽기 - 따옴표 안의 쉼표, 식품 정보")
    void testLoadAll_QuotedFields() throws IOException {
        Files.writeString(file, HEADER
                + "p002,Greek Yoghurt,Chobani,Plain,Dairy,Yoghurt,7.50,6.90,25,true,2026-12-15,"
                + "\"Milk, live cultures\",Keep refrigerated,Milk\n", StandardCharsets.UTF_8);

        Product yoghurt = repository().findByKey("P002").orElseThrow();

        assertEquals("Milk, live cultures", yoghurt.getIngredients());
        assertTrue(yoghurt.isFood());
        assertEquals(LocalDate.of(2026, 12, 15), yoghurt.getExpiryDate());
        assertEquals(Money.of("6.90"), yoghurt.getMemberPrice());
    }

    @Test
    @DisplayName("읽기 - 잘못된 행은 건너뛰고 나머지는 적재")
    void testLoadAll_SkipsMalformedRows() throws IOException {
        Files.writeString(file, HEADER
                + "P100,Pen,Campus,,Stationery,Writing,2.50,2.00,30,false,,,,\n"
                + "P101,Broken,Campus,,Stationery,Writing,abc,2.00,30,false,,,,\n"
                + "P102,Dearer VIP,Campus,,Stationery,Writing,2.00,3.00,30,false,,,,\n", StandardCharsets.UTF_8);

        List<Product> products = repository().loadAll();

        assertEquals(1, products.size());
        assertEquals("P100", products.get(0).getSku());
    }

    @Test
    @DisplayName("읽기 실패 - 디렉터리를 파일로 읽으면 PersistenceException")
    void testLoadAll_Unreadable() throws IOException {
        Files.createDirectories(file);

        assertThrows(PersistenceException.class, () -> repository().loadAll());
    }

    @Test
    @DisplayName("저장 - 다시 읽어도 같은 값, 빈 카탈로그는 헤더만")
    void testSaveAll_RoundTrip() throws IOException {
        CsvProductRepository repository = repository();
        repository.upsert(Product.createProduct("P100", "Pen", "Campus", "Blue, fine tip", "Stationery", "Writing",
                Money.of("2.50"), Money.of("2.00"), 30));
        repository.saveAll();

        Product reloaded = repository().findByKey("p100").orElseThrow();
        assertEquals("Blue, fine tip", reloaded.getDescription());
        assertEquals(30, reloaded.getStock());

        repository.deleteByKey("P100");
        repository.saveAll();
        assertEquals("sku", Files.readAllLines(file).get(0).split(",")[0]);
        assertTrue(repository().loadAll().isEmpty());
    }

    @Test
    @DisplayName("검색 - 조건 조합, 재고 있는 상품 먼저")
    void testFindByFilter() {
        CsvProductRepository repository = repository();
        repository.upsert(Product.createProduct("P1", "Zinc Cream", "SunCo", "", "Health", "Sun",
                Money.of("9.00"), Money.of("8.00"), 3));
        repository.upsert(Product.createProduct("P2", "Aloe Gel", "SunCo", "", "Health", "Sun",
                Money.of("6.00"), Money.of("5.00"), 0));
        repository.upsert(Product.createProduct("P3", "Bandages", "Care", "", "Health", "First aid",
                Money.of("4.00"), Money.of("3.50"), 10));

        List<String> all = repository.findByFilter(ProductFilter.none()).stream()
                .map(Product::getSku).collect(Collectors.toList());
        List<String> sunInStock = repository.findByFilter(ProductFilter.builder()
                        .subcategory("sun")
                        .availability(ProductFilter.Availability.IN_STOCK)
                        .build()).stream()
                .map(Product::getSku).collect(Collectors.toList());
        List<String> cheap = repository.findByFilter(ProductFilter.builder()
                        .priceMax(Money.of("6.00"))
                        .build()).stream()
                .map(Product::getSku).collect(Collectors.toList());

        assertThat(all).containsExactly("P3", "P1", "P2");
        assertThat(sunInStock).containsExactly("P1");
        assertThat(cheap).containsExactly("P3", "P2");
        assertThat(repository.findCategories()).containsExactly("Health");
    }
}

package com.mmoss.ecommerce.infrastructure.persistence;

import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.infrastructure.persistence.order.CsvOrderRepository;
import com.mmoss.ecommerce.support.ShopTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CsvOrderRepository 테스트
 * - 추가 전용 기록
 * - 항목 JSON 열 왕복
 * - 고객별 조회와 픽업 이력
 */
@DisplayName("CsvOrderRepository 테스트")
class CsvOrderRepositoryTest {

    @TempDir
    Path dataDir;

    private ShopTestFixture fixture;
    private OrderLine notebookLine;

    @BeforeEach
    void setUp() {
        fixture = new ShopTestFixture(dataDir);
        Product notebook = Product.createProduct("P009", "A4 Notebook, ruled", "Campus", "",
                "Stationery", "Paper", Money.of("19.99"), Money.of("17.99"), 12);
        notebookLine = OrderLine.snapshot(notebook, 2, true);
    }

    private Order order(String email, FulfilmentMode mode) {
        return Order.createOrder(email, mode, "1 Test St", "S1", null, true, List.of(notebookLine),
                Money.of("35.98"), Money.ZERO, Money.ZERO, Money.of("20.00"),
                LocalDateTime.of(2026, 5, 1, 11, 0, 30, 123_000_000));
    }

    private CsvOrderRepository reload() {
        return new CsvOrderRepository(dataDir.resolve(CsvOrderRepository.FILE_NAME),
                fixture.csvMapper, fixture.objectMapper);
    }

    @Test
    @DisplayName("추가 - 파일에 한 줄씩 기록, 다시 읽으면 같은 주문")
    void testAppend_RoundTrip() throws Exception {
        Order placed = order("jo@example.com", FulfilmentMode.DELIVERY);

        fixture.orderRepository.append(placed);

        assertEquals(2, Files.readAllLines(dataDir.resolve(CsvOrderRepository.FILE_NAME)).size());
        Order reloaded = reload().findByKey(placed.getOrderId()).orElseThrow();
        assertEquals(Money.of("55.98"), reloaded.getTotal());
        assertEquals("1 Test St", reloaded.getDeliveryAddress());
        assertNull(reloaded.getStoreId());
        assertTrue(reloaded.isVipPricing());
        assertEquals(LocalDateTime.of(2026, 5, 1, 11, 0, 30), reloaded.getPlacedAt());

        OrderLine line = reloaded.getLines().get(0);
        assertEquals("A4 Notebook, ruled", line.getName());
        assertEquals(Money.of("17.99"), line.getUnitPrice());
        assertEquals(Money.of("19.99"), line.getRegularPrice());
        assertEquals(Money.of("35.98"), line.getLineTotal());
    }

    @Test
    @DisplayName("추가 실패 - 같은 주문 ID")
    void testAppend_DuplicateId() {
        Order placed = order("jo@example.com", FulfilmentMode.DELIVERY);
        fixture.orderRepository.append(placed);

        assertThrows(PersistenceException.class, () -> fixture.orderRepository.append(placed));
        assertEquals(1, reload().findAll().size());
    }

    @Test
    @DisplayName("조회 - 고객별 주문과 픽업 이력")
    void testFindByEmail_AndPickupHistory() {
        fixture.orderRepository.append(order("jo@example.com", FulfilmentMode.DELIVERY));
        fixture.orderRepository.append(order("kim@example.com", FulfilmentMode.PICKUP));

        CsvOrderRepository reloaded = reload();

        assertEquals(1, reloaded.findByEmail("JO@example.com").size());
        assertFalse(reloaded.hasPickupOrder("jo@example.com"));
        assertTrue(reloaded.hasPickupOrder("kim@example.com"));
        assertEquals(2, reloaded.findAll().size());
    }
}

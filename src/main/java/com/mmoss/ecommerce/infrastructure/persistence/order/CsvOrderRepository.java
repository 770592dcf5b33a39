package com.mmoss.ecommerce.infrastructure.persistence.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.order.FulfilmentMode;
import com.mmoss.ecommerce.domain.order.Order;
import com.mmoss.ecommerce.domain.order.OrderLine;
import com.mmoss.ecommerce.domain.order.OrderRepository;
import com.mmoss.ecommerce.domain.user.User;
import com.mmoss.ecommerce.infrastructure.persistence.common.AbstractCsvRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.CsvFileStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * CsvOrderRepository - orders.csv 기반 주문 로그 (추가 전용)
 *
 * 책임:
 * - 주문 한 건을 파일 끝에 추가
 * - 고객별/전체 주문 조회
 * - 픽업 주문 이력 확인 (NEWMONASH20 자격 판정)
 */
@Repository
public class CsvOrderRepository extends AbstractCsvRepository<Order, OrderRow> implements OrderRepository {

    public static final String FILE_NAME = "orders.csv";

    private static final TypeReference<List<OrderLineJson>> LINES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Autowired
    public CsvOrderRepository(ShopPolicy shopPolicy, CsvMapper csvMapper, ObjectMapper objectMapper) {
        this(Path.of(shopPolicy.getDataDir(), FILE_NAME), csvMapper, objectMapper);
    }

    public CsvOrderRepository(Path file, CsvMapper csvMapper, ObjectMapper objectMapper) {
        super(new CsvFileStore<>(file, OrderRow.class, csvMapper));
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Order order) {
        if (containsKey(order.getOrderId())) {
            throw new PersistenceException("duplicate order id " + order.getOrderId(), null);
        }
        fileStore.append(toRow(order));
        putInCache(order);
        log.info("[CsvOrderRepository] 주문 기록 완료: orderId={}, email={}, total={}",
                order.getOrderId(), order.getEmail(), order.getTotal().toPlainString());
    }

    /**
     * 주문은 불변이므로 새 주문 추가로만 동작한다.
     */
    @Override
    public void upsert(Order order) {
        append(order);
    }

    @Override
    public List<Order> findAll() {
        return List.copyOf(cachedValues());
    }

    @Override
    public List<Order> findByEmail(String email) {
        String normalized = User.normalizeEmail(email);
        return cachedValues().stream()
                .filter(o -> o.getEmail().equals(normalized))
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasPickupOrder(String email) {
        String normalized = User.normalizeEmail(email);
        return cachedValues().stream()
                .anyMatch(o -> o.getEmail().equals(normalized) && o.isPickup());
    }

    @Override
    protected String normalizeKey(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    protected String keyOf(Order order) {
        return order.getOrderId();
    }

    @Override
    protected Order toDomain(OrderRow row) {
        List<OrderLine> lines = readLines(row.getLinesJson()).stream()
                .map(line -> OrderLine.builder()
                        .sku(line.getSku())
                        .name(line.getName())
                        .quantity(line.getQuantity())
                        .regularPrice(Money.of(line.getRegularPrice()))
                        .memberPrice(Money.of(line.getMemberPrice()))
                        .unitPrice(Money.of(line.getUnitPrice()))
                        .lineTotal(Money.of(line.getLineTotal()))
                        .build())
                .collect(Collectors.toList());

        return Order.builder()
                .orderId(normalizeKey(row.getOrderId()))
                .email(User.normalizeEmail(row.getEmail()))
                .placedAt(LocalDateTime.parse(row.getDatetime().trim()))
                .fulfilment(FulfilmentMode.fromString(row.getFulfilment()))
                .deliveryAddress(blankToNull(row.getDeliveryAddress()))
                .storeId(blankToNull(row.getStoreId()))
                .promoCode(blankToNull(row.getPromoCode()))
                .vipPricing(Boolean.parseBoolean(blankToNull(row.getVipPricing())))
                .lines(lines)
                .subtotal(Money.of(row.getSubtotal()))
                .studentDiscount(moneyOrZero(row.getStudentDiscount()))
                .promoDiscount(moneyOrZero(row.getPromoDiscount()))
                .deliveryFee(moneyOrZero(row.getDeliveryFee()))
                .total(Money.of(row.getTotal()))
                .build();
    }

    @Override
    protected OrderRow toRow(Order order) {
        OrderRow row = new OrderRow();
        row.setOrderId(order.getOrderId());
        row.setEmail(order.getEmail());
        row.setDatetime(order.getPlacedAt().truncatedTo(ChronoUnit.SECONDS).toString());
        row.setFulfilment(order.getFulfilment().name());
        row.setDeliveryAddress(nullToEmpty(order.getDeliveryAddress()));
        row.setStoreId(nullToEmpty(order.getStoreId()));
        row.setPromoCode(nullToEmpty(order.getPromoCode()));
        row.setPromoDiscount(order.getPromoDiscount().toPlainString());
        row.setStudentDiscount(order.getStudentDiscount().toPlainString());
        row.setDeliveryFee(order.getDeliveryFee().toPlainString());
        row.setSubtotal(order.getSubtotal().toPlainString());
        row.setTotal(order.getTotal().toPlainString());
        row.setVipPricing(String.valueOf(order.isVipPricing()));
        row.setLinesJson(writeLines(order.getLines()));
        return row;
    }

    private List<OrderLineJson> readLines(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("주문 항목이 비어 있습니다");
        }
        try {
            return objectMapper.readValue(json, LINES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("lines_json 형식 오류: " + e.getOriginalMessage(), e);
        }
    }

    private String writeLines(List<OrderLine> lines) {
        List<OrderLineJson> json = lines.stream()
                .map(line -> new OrderLineJson(line.getSku(), line.getName(), line.getQuantity(),
                        line.getRegularPrice().getAmount(), line.getMemberPrice().getAmount(),
                        line.getUnitPrice().getAmount(), line.getLineTotal().getAmount()))
                .collect(Collectors.toList());
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("serialize order lines", e);
        }
    }

    private static Money moneyOrZero(String value) {
        String trimmed = blankToNull(value);
        return trimmed == null ? Money.ZERO : Money.of(trimmed);
    }
}

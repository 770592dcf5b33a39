package com.mmoss.ecommerce.infrastructure.persistence.store;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.store.StoreRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.AbstractCsvRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.CsvFileStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;

/**
 * CsvStoreRepository - stores.csv 기반 픽업 매장 저장소
 */
@Repository
public class CsvStoreRepository extends AbstractCsvRepository<PickupStore, StoreRow> implements StoreRepository {

    public static final String FILE_NAME = "stores.csv";

    @Autowired
    public CsvStoreRepository(ShopPolicy shopPolicy, CsvMapper csvMapper) {
        this(Path.of(shopPolicy.getDataDir(), FILE_NAME), csvMapper);
    }

    public CsvStoreRepository(Path file, CsvMapper csvMapper) {
        super(new CsvFileStore<>(file, StoreRow.class, csvMapper));
    }

    @Override
    protected String normalizeKey(String key) {
        return PickupStore.normalizeId(key);
    }

    @Override
    protected String keyOf(PickupStore store) {
        return store.getStoreId();
    }

    @Override
    protected PickupStore toDomain(StoreRow row) {
        String storeId = PickupStore.normalizeId(row.getStoreId());
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("매장 ID가 비어 있습니다");
        }
        return PickupStore.builder()
                .storeId(storeId)
                .name(nullToEmpty(row.getName()))
                .address(nullToEmpty(row.getAddress()))
                .phone(nullToEmpty(row.getPhone()))
                .hours(nullToEmpty(row.getHours()))
                .build();
    }

    @Override
    protected StoreRow toRow(PickupStore store) {
        StoreRow row = new StoreRow();
        row.setStoreId(store.getStoreId());
        row.setName(store.getName());
        row.setAddress(store.getAddress());
        row.setPhone(store.getPhone());
        row.setHours(store.getHours());
        return row;
    }
}

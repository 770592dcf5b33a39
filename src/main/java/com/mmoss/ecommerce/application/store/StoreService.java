package com.mmoss.ecommerce.application.store;

import com.mmoss.ecommerce.domain.store.PickupStore;
import com.mmoss.ecommerce.domain.store.StoreRepository;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 픽업 매장 조회
 */
@Service
public class StoreService {

    private final StoreRepository storeRepository;

    public StoreService(StoreRepository storeRepository) {
        this.storeRepository = storeRepository;
    }

    public List<PickupStore> listStores() {
        return storeRepository.loadAll().stream()
                .sorted(Comparator.comparing(PickupStore::getStoreId))
                .collect(Collectors.toList());
    }
}

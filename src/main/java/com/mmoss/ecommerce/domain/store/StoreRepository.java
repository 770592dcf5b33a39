package com.mmoss.ecommerce.domain.store;

import com.mmoss.ecommerce.domain.common.repository.KeyedRepository;

/**
 * 픽업 매장 저장소 (키: 매장 ID, 대소문자 무시)
 */
public interface StoreRepository extends KeyedRepository<String, PickupStore> {
}

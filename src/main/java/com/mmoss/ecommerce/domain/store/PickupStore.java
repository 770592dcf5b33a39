package com.mmoss.ecommerce.domain.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;

/**
 * 픽업 매장 정보
 */
@Getter
@Builder
@AllArgsConstructor
public class PickupStore {

    private final String storeId;
    private final String name;
    private final String address;
    private final String phone;
    private final String hours;

    public static String normalizeId(String storeId) {
        return storeId == null ? null : storeId.trim().toUpperCase(Locale.ROOT);
    }
}

package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

import java.util.Comparator;

/**
 * ProductFilter - 상품 검색 조건
 *
 * 모든 조건은 선택 사항이며, null이면 해당 조건을 적용하지 않는다.
 * 문자열 조건은 대소문자를 무시한 완전 일치.
 */
@Getter
@Builder
public class ProductFilter {

    /** 재고 있는 상품 우선, 그 다음 이름순 */
    public static final Comparator<Product> DISPLAY_ORDER = Comparator
            .comparing((Product p) -> !p.isInStock())
            .thenComparing(Product::getName, String.CASE_INSENSITIVE_ORDER);

    private final String category;
    private final String subcategory;
    private final String brand;
    private final Money priceMin;
    private final Money priceMax;
    private final Availability availability;

    public enum Availability {
        IN_STOCK,
        OUT_OF_STOCK
    }

    public static ProductFilter none() {
        return ProductFilter.builder().build();
    }

    public boolean matches(Product product) {
        if (!equalsIgnoreCase(category, product.getCategory())) return false;
        if (!equalsIgnoreCase(subcategory, product.getSubcategory())) return false;
        if (!equalsIgnoreCase(brand, product.getBrand())) return false;
        if (priceMin != null && product.getPrice().isLessThan(priceMin)) return false;
        if (priceMax != null && product.getPrice().isGreaterThan(priceMax)) return false;
        if (availability == Availability.IN_STOCK && !product.isInStock()) return false;
        if (availability == Availability.OUT_OF_STOCK && product.isInStock()) return false;
        return true;
    }

    private static boolean equalsIgnoreCase(String expected, String actual) {
        return expected == null || expected.isBlank() || expected.trim().equalsIgnoreCase(actual);
    }
}

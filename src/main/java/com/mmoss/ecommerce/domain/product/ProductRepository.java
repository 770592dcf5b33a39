package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.domain.common.repository.KeyedRepository;

import java.util.List;

/**
 * ProductRepository - 상품 저장소 인터페이스 (Domain 계층)
 *
 * 키는 SKU (대소문자 무시).
 */
public interface ProductRepository extends KeyedRepository<String, Product> {

    /**
     * 캐시에서 삭제 (저장 매체 반영은 saveAll)
     *
     * @return 삭제 여부
     */
    boolean deleteByKey(String sku);

    /**
     * 필터 조건에 맞는 상품 조회 (재고 있는 상품 우선, 이름순)
     */
    List<Product> findByFilter(ProductFilter filter);

    /**
     * 카탈로그에 존재하는 카테고리 목록 (이름순, 중복 제거)
     */
    List<String> findCategories();
}

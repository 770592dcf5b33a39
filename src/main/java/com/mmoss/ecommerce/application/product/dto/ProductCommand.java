package com.mmoss.ecommerce.application.product.dto;

import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * ProductCommand - 관리자 상품 추가/수정 입력
 *
 * 수정 시 null이거나 공백인 필드는 기존 값을 유지한다.
 */
@Getter
@Builder
public class ProductCommand {

    private final String sku;
    private final String name;
    private final String brand;
    private final String description;
    private final String category;
    private final String subcategory;
    private final Money price;
    private final Money memberPrice;
    private final Integer stock;
    private final Boolean food;
    private final LocalDate expiryDate;
    private final String ingredients;
    private final String storage;
    private final String allergens;
}

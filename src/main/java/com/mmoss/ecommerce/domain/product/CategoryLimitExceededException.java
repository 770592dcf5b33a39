package com.mmoss.ecommerce.domain.product;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 새 카테고리 추가로 카탈로그 전체 카테고리 수가 상한을 넘을 때 발생
 */
@Getter
public class CategoryLimitExceededException extends DomainException {

    private final String category;
    private final int maxCategories;

    public CategoryLimitExceededException(String category, int maxCategories) {
        super(ErrorCode.CATEGORY_LIMIT_EXCEEDED,
                String.format("'%s' would exceed the maximum of %d categories", category, maxCategories));
        this.category = category;
        this.maxCategories = maxCategories;
    }
}

package com.mmoss.ecommerce.domain.promotion;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * InvalidPromoException - 프로모션 코드 적용 불가
 *
 * 발생 조건:
 * - 존재하지 않는 코드
 * - 자격 조건 불충족 (수령 방식, 첫 픽업 주문, 교직원 전용)
 * - 학생 픽업 할인과 중복 적용 시도
 *
 * 결제는 차단되지 않으며, 견적에 안내 메시지로 포함된다.
 */
@Getter
public class InvalidPromoException extends DomainException {

    private final String code;
    private final String reason;

    public InvalidPromoException(String code, String reason) {
        super(ErrorCode.INVALID_PROMO, code + ": " + reason);
        this.code = code;
        this.reason = reason;
    }
}

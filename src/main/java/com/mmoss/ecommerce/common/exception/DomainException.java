package com.mmoss.ecommerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 쇼핑 도메인의 규칙 위반 시 발생
 * - 콘솔에 메시지를 출력하고 작업을 중단하며, 상태는 변경되지 않음
 *
 * 사용 예:
 * - OutOfStockException: 재고 부족
 * - InsufficientFundsException: 잔액 부족
 * - CartLimitExceededException: 장바구니 한도 초과
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}

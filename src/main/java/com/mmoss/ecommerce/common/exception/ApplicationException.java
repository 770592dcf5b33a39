package com.mmoss.ecommerce.common.exception;

/**
 * ApplicationException - 애플리케이션 처리 흐름 실패 예외
 *
 * 사용 예:
 * - 관리자 전용 기능을 고객 계정으로 호출
 * - 고객 전용 결제를 관리자 계정으로 호출
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}

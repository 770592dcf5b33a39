package com.mmoss.ecommerce.common.exception;

/**
 * SystemException - 시스템 레벨 예외
 *
 * 역할:
 * - CSV 파일 읽기/쓰기 실패 등 인프라 오류
 * - 사용자 입력과 무관한 실패
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}

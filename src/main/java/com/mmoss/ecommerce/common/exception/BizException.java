package com.mmoss.ecommerce.common.exception;

/**
 * BizException - 비즈니스 예외의 최상위 클래스
 *
 * 역할:
 * - 모든 비즈니스 예외의 기본 클래스
 * - 에러 코드와 사용자 표시 메시지 보관
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (도메인 규칙 위반: 장바구니 한도, 재고, 잔액, 프로모션, 주소 등)
 * ├─ ApplicationException (처리 흐름 실패: 권한 없음 등)
 * └─ SystemException (파일 저장/로드 실패)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }

    public boolean isRecoverable() {
        return errorCode.isRecoverable();
    }
}

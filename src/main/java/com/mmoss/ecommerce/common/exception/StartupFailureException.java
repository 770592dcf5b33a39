package com.mmoss.ecommerce.common.exception;

/**
 * StartupFailureException - 데이터 파일 준비 실패
 *
 * 데이터 디렉터리 생성이나 시드 파일 작성이 불가능할 때 발생하며,
 * 애플리케이션은 진단 메시지와 함께 종료된다.
 */
public class StartupFailureException extends SystemException {

    public StartupFailureException(String detailMessage, Throwable cause) {
        super(ErrorCode.STARTUP_FAILURE, detailMessage, cause);
    }
}

package com.mmoss.ecommerce.common.exception;

/**
 * PersistenceException - CSV 파일 저장/로드 실패
 *
 * 저장소 구현체가 IOException을 감싸서 던진다.
 * 결제 중 발생하면 CheckoutTransactionService가 메모리 상태를 되돌린 뒤 다시 던진다.
 */
public class PersistenceException extends SystemException {

    public PersistenceException(String detailMessage, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, detailMessage, cause);
    }
}

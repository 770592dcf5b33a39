package com.mmoss.ecommerce.presentation.console;

/**
 * 표준 입력이 닫혔을 때 (EOF) 콘솔 루프를 종료하기 위한 신호
 */
public class InputClosedException extends RuntimeException {

    public InputClosedException() {
        super("console input closed");
    }
}

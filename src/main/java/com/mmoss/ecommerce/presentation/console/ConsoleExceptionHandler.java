package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.common.exception.BizException;
import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.SystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ConsoleExceptionHandler - 콘솔 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 메뉴 동작 중 발생한 예외를 사용자 메시지로 변환
 * - 작업은 중단되고 콘솔 루프는 계속된다
 *
 * 매핑:
 * - DomainException: 규칙 위반 메시지 그대로 출력
 * - SystemException: 저장 실패 안내, 에러 로그
 * - 기타 BizException: 메시지 출력
 * - IllegalArgumentException: 입력 오류로 출력
 * - 그 외: 예기치 못한 오류 안내, 에러 로그
 */
@Component
public class ConsoleExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ConsoleExceptionHandler.class);

    public void handle(ConsoleIO io, RuntimeException e) {
        if (e instanceof InputClosedException) {
            throw e;
        }
        if (e instanceof DomainException) {
            log.info("[ConsoleExceptionHandler] 도메인 규칙 위반: code={}, message={}",
                    ((DomainException) e).getErrorCodeValue(), e.getMessage());
            io.println("  ! " + e.getMessage());
        } else if (e instanceof SystemException) {
            log.error("[ConsoleExceptionHandler] 시스템 오류: code={}", ((SystemException) e).getErrorCodeValue(), e);
            io.println("  ! " + e.getMessage() + ". Nothing was changed, please try again.");
        } else if (e instanceof BizException) {
            log.warn("[ConsoleExceptionHandler] 처리 실패: code={}, message={}",
                    ((BizException) e).getErrorCodeValue(), e.getMessage());
            io.println("  ! " + e.getMessage());
        } else if (e instanceof IllegalArgumentException) {
            log.info("[ConsoleExceptionHandler] 입력 오류: {}", e.getMessage());
            io.println("  ! Invalid input: " + e.getMessage());
        } else {
            log.error("[ConsoleExceptionHandler] 예기치 못한 오류", e);
            io.println("  ! Unexpected error, details were written to the log.");
        }
    }

    /**
     * 동작 실행, 예외는 메시지로 변환
     *
     * @return 성공 여부
     */
    public boolean run(ConsoleIO io, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            handle(io, e);
            return false;
        }
    }
}

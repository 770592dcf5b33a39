package com.mmoss.ecommerce;

import com.mmoss.ecommerce.common.exception.StartupFailureException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MMOSS 슈퍼마켓 콘솔 애플리케이션 메인 클래스
 *
 * 실행 순서:
 * 1. DataFileInitializer: 데이터 디렉터리와 시드 파일 준비
 * 2. ConsoleRunner: 로그인 메뉴 실행
 *
 * 데이터 파일을 준비하지 못하면 원인을 출력하고 종료 코드 1로 끝낸다.
 */
@SpringBootApplication
public class ECommerceApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(ECommerceApplication.class, args);
        } catch (RuntimeException e) {
            StartupFailureException failure = findStartupFailure(e);
            if (failure == null) {
                throw e;
            }
            System.err.println("MMOSS could not start: " + failure.getMessage());
            if (failure.getCause() != null) {
                System.err.println("Cause: " + failure.getCause().getMessage());
            }
            System.exit(1);
        }
    }

    static StartupFailureException findStartupFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StartupFailureException) {
                return (StartupFailureException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}

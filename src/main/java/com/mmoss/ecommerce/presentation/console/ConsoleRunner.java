package com.mmoss.ecommerce.presentation.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * ConsoleRunner - 표준 입출력 대화형 콘솔 진입점
 *
 * 데이터 파일 초기화(DataFileInitializer) 이후 실행된다.
 * 테스트에서는 mmoss.console.enabled=false 로 비활성화한다.
 */
@Component
@Order(2)
@ConditionalOnProperty(name = "mmoss.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRunner.class);

    private final LoginMenu loginMenu;

    public ConsoleRunner(LoginMenu loginMenu) {
        this.loginMenu = loginMenu;
    }

    @Override
    public void run(String... args) {
        ConsoleIO io = new ConsoleIO(System.in, System.out);
        log.info("[ConsoleRunner] 콘솔 시작");
        try {
            loginMenu.show(io);
        } catch (InputClosedException e) {
            log.info("[ConsoleRunner] 입력 종료로 콘솔 종료");
            io.println();
            io.println("Input closed, exiting.");
        }
        log.info("[ConsoleRunner] 콘솔 종료");
    }
}

package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.user.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConsoleExceptionHandler 테스트
 * - 예외 종류별 안내 메시지
 * - 입력 종료는 그대로 전달
 */
@DisplayName("ConsoleExceptionHandler 테스트")
class ConsoleExceptionHandlerTest {

    private final ConsoleExceptionHandler handler = new ConsoleExceptionHandler();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final ConsoleIO io = new ConsoleIO(new ByteArrayInputStream(new byte[0]),
            new PrintStream(output, true, StandardCharsets.UTF_8));

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("입력 오류 - 도메인 검증 메시지를 그대로 영어로 표시")
    void testHandle_InvalidInput() {
        boolean succeeded = handler.run(io, () -> Money.of("abc"));

        assertFalse(succeeded);
        assertThat(output()).contains("  ! Invalid input: Not a valid amount: abc");
    }

    @Test
    @DisplayName("입력 오류 - 회원 정보 검증 메시지")
    void testHandle_InvalidContact() {
        User user = User.createCustomer("jo@example.com", "hash", "Jo", "Shopper", false, Money.ZERO);

        handler.run(io, () -> user.updateContact("call me", "1 Test St"));

        assertThat(output()).contains("  ! Invalid input: Mobile may only contain digits, spaces and dashes");
    }

    @Test
    @DisplayName("도메인/시스템 예외 - 오류 코드 메시지 표시")
    void testHandle_BizExceptions() {
        handler.run(io, () -> {
            throw new ProductNotFoundException("P404");
        });
        handler.run(io, () -> {
            throw new PersistenceException("write products.csv", new IOException("disk full"));
        });

        assertThat(output())
                .contains("  ! Product not found | SKU P404")
                .contains("Nothing was changed, please try again.");
    }

    @Test
    @DisplayName("입력 종료 - 처리하지 않고 다시 던짐")
    void testHandle_InputClosedRethrown() {
        assertThrows(InputClosedException.class, () -> handler.run(io, () -> {
            throw new InputClosedException();
        }));
    }
}

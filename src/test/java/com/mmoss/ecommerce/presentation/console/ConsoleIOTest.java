package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.domain.common.vo.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConsoleIO / TableFormatter 테스트
 * - 잘못된 입력 재질문
 * - 입력 종료 처리
 * - 표 정렬과 말줄임
 */
@DisplayName("ConsoleIO 테스트")
class ConsoleIOTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleIO console(String input) {
        return new ConsoleIO(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("정수 입력 - 범위 밖/문자는 다시 묻기")
    void testReadInt_Reprompts() {
        ConsoleIO io = console("abc\n11\n7\n");

        assertEquals(7, io.readInt("Quantity", 1, 10));
        assertThat(output()).contains("Please enter a whole number between 1 and 10.");
    }

    @Test
    @DisplayName("금액 입력 - 음수는 다시 묻기, 선택 입력은 빈 값이면 null")
    void testReadMoney() {
        ConsoleIO io = console("-5\n$12.5\n\n");

        assertEquals(Money.of("12.50"), io.readMoney("Amount"));
        assertNull(io.readOptionalMoney("Price"));
    }

    @Test
    @DisplayName("예/아니오, 날짜, 메뉴 선택 입력")
    void testConfirmDateAndChoice() {
        ConsoleIO io = console("maybe\ny\n2026-13-01\n2026-12-01\nm\n");

        assertTrue(io.confirm("Continue?"));
        assertEquals(LocalDate.of(2026, 12, 1), io.readOptionalDate("Expiry"));
        assertEquals(ConsoleIO.MAIN_MENU, io.readChoice());
    }

    @Test
    @DisplayName("입력 종료 - InputClosedException")
    void testPrompt_EndOfInput() {
        ConsoleIO io = console("");

        assertThrows(InputClosedException.class, () -> io.readRequired("Email"));
    }

    @Test
    @DisplayName("표 - 열 정렬, 긴 값은 말줄임")
    void testTableFormatter() {
        String longName = "x".repeat(40);

        String table = TableFormatter.format(List.of("SKU", "Name"),
                List.of(List.of("P1", "Milk"), List.of("P22", longName)));
        String[] lines = table.split(System.lineSeparator());

        assertEquals(4, lines.length);
        assertEquals("SKU | Name", lines[0].trim().substring(0, 10));
        assertTrue(lines[3].endsWith("..."));
        assertEquals(lines[2].indexOf('|'), lines[3].indexOf('|'));
        assertTrue(lines[3].length() <= 3 + 3 + TableFormatter.MAX_COLUMN_WIDTH);
    }
}

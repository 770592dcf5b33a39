package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.domain.common.vo.Money;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * ConsoleIO - 콘솔 입출력 래퍼
 *
 * 책임:
 * - 프롬프트 출력 후 한 줄 입력
 * - 숫자/금액/날짜/예·아니오 입력 파싱, 잘못된 입력은 다시 묻기
 * - 입력 종료(EOF)는 InputClosedException으로 알림
 *
 * 메뉴 이동 키: "0" 이전 메뉴, "M" 메인 메뉴
 */
public class ConsoleIO {

    public static final String BACK = "0";
    public static final String MAIN_MENU = "M";

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsoleIO(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public void println() {
        out.println();
    }

    public void println(String line) {
        out.println(line);
    }

    public void printf(String format, Object... args) {
        out.printf(format, args);
    }

    public void heading(String title) {
        out.println();
        out.println("=== " + title + " ===");
    }

    /**
     * 한 줄 입력 (앞뒤 공백 제거)
     *
     * @throws InputClosedException 입력 종료
     */
    public String prompt(String label) {
        out.print(label + ": ");
        out.flush();
        try {
            String line = reader.readLine();
            if (line == null) {
                throw new InputClosedException();
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 메뉴 선택 입력 (대문자로 정규화)
     */
    public String readChoice() {
        return prompt("Select").toUpperCase(Locale.ROOT);
    }

    public String readRequired(String label) {
        while (true) {
            String value = prompt(label);
            if (!value.isEmpty()) {
                return value;
            }
            println("  A value is required.");
        }
    }

    /**
     * 범위 내 정수 입력 (잘못된 입력은 다시 묻기)
     */
    public int readInt(String label, int min, int max) {
        while (true) {
            Integer parsed = parseInt(prompt(label + " (" + min + "-" + max + ")"));
            if (parsed != null && parsed >= min && parsed <= max) {
                return parsed;
            }
            println("  Please enter a whole number between " + min + " and " + max + ".");
        }
    }

    /**
     * 선택 입력 정수 (빈 값이면 null)
     */
    public Integer readOptionalInt(String label, int min) {
        while (true) {
            String value = prompt(label + " (blank to keep)");
            if (value.isEmpty()) {
                return null;
            }
            Integer parsed = parseInt(value);
            if (parsed != null && parsed >= min) {
                return parsed;
            }
            println("  Please enter a whole number of at least " + min + ".");
        }
    }

    public Money readMoney(String label) {
        while (true) {
            Money money = parseMoney(prompt(label + " ($)"));
            if (money != null) {
                return money;
            }
            println("  Please enter a non-negative amount such as 12.50.");
        }
    }

    /**
     * 선택 입력 금액 (빈 값이면 null)
     */
    public Money readOptionalMoney(String label) {
        while (true) {
            String value = prompt(label + " ($, blank to keep)");
            if (value.isEmpty()) {
                return null;
            }
            Money money = parseMoney(value);
            if (money != null) {
                return money;
            }
            println("  Please enter a non-negative amount such as 12.50.");
        }
    }

    /**
     * 선택 입력 날짜 (YYYY-MM-DD, 빈 값이면 null)
     */
    public LocalDate readOptionalDate(String label) {
        while (true) {
            String value = prompt(label + " (YYYY-MM-DD, blank to skip)");
            if (value.isEmpty()) {
                return null;
            }
            try {
                return LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                println("  Please use the format YYYY-MM-DD.");
            }
        }
    }

    public boolean confirm(String question) {
        while (true) {
            String value = prompt(question + " (Y/N)").toUpperCase(Locale.ROOT);
            if (value.equals("Y") || value.equals("YES")) {
                return true;
            }
            if (value.equals("N") || value.equals("NO")) {
                return false;
            }
            println("  Please answer Y or N.");
        }
    }

    /**
     * 선택 입력 예/아니오 (빈 값이면 null)
     */
    public Boolean readOptionalYesNo(String question) {
        while (true) {
            String value = prompt(question + " (Y/N, blank to keep)").toUpperCase(Locale.ROOT);
            if (value.isEmpty()) {
                return null;
            }
            if (value.equals("Y") || value.equals("YES")) {
                return Boolean.TRUE;
            }
            if (value.equals("N") || value.equals("NO")) {
                return Boolean.FALSE;
            }
            println("  Please answer Y or N.");
        }
    }

    public void invalidChoice() {
        println("  Invalid option, please try again.");
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Money parseMoney(String value) {
        try {
            return Money.of(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

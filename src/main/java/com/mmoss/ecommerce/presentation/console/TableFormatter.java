package com.mmoss.ecommerce.presentation.console;

import java.util.ArrayList;
import java.util.List;

/**
 * TableFormatter - 고정폭 텍스트 표 출력
 *
 * 각 열 너비는 헤더와 값 중 가장 긴 길이, 최대 MAX_COLUMN_WIDTH (초과 시 "..." 처리).
 */
public final class TableFormatter {

    static final int MAX_COLUMN_WIDTH = 32;

    private TableFormatter() {
        throw new AssertionError("TableFormatter는 인스턴스화할 수 없습니다");
    }

    public static String format(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length && i < row.size(); i++) {
                widths[i] = Math.max(widths[i], cell(row.get(i)).length());
            }
        }
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.min(widths[i], MAX_COLUMN_WIDTH);
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths);
        List<String> separator = new ArrayList<>();
        for (int width : widths) {
            separator.add("-".repeat(width));
        }
        appendRow(sb, separator, widths);
        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> values, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            String value = i < values.size() ? truncate(cell(values.get(i)), widths[i]) : "";
            sb.append(String.format("%-" + widths[i] + "s", value));
            if (i < widths.length - 1) {
                sb.append(" | ");
            }
        }
        sb.append(System.lineSeparator());
    }

    private static String cell(String value) {
        return value == null ? "" : value;
    }

    private static String truncate(String value, int width) {
        if (value.length() <= width) {
            return value;
        }
        return value.substring(0, width - 3) + "...";
    }
}

package com.mmoss.ecommerce.domain.user;

import java.util.regex.Pattern;

/**
 * UserConstants - 사용자 도메인 상수
 *
 * 역할:
 * - 연락처/비밀번호 검증 규칙
 * - 학생 이메일 도메인
 */
public class UserConstants {

    // ========== Contact ==========

    /** 숫자, 공백, 하이픈만 허용하며 숫자로 시작하고 끝남 */
    public static final Pattern MOBILE_PATTERN = Pattern.compile("^\\d[\\d -]*\\d$|^\\d$");

    // ========== Password ==========

    public static final int MIN_PASSWORD_LENGTH = 8;

    // ========== Student ==========

    public static final String STUDENT_EMAIL_DOMAIN = "student.monash.edu";

    // ========== Messages ==========

    public static final String MSG_INVALID_MOBILE = "Mobile may only contain digits, spaces and dashes";
    public static final String MSG_BLANK_ADDRESS = "Address cannot be empty";
    public static final String MSG_WEAK_PASSWORD = String.format(
            "Password needs at least %d characters, one uppercase letter and one digit", MIN_PASSWORD_LENGTH);
    public static final String MSG_WRONG_PASSWORD = "Current password is incorrect";

    private UserConstants() {
        throw new AssertionError("UserConstants는 인스턴스화할 수 없습니다");
    }
}

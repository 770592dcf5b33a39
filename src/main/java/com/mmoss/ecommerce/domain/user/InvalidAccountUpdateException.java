package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 계정 변경 요청(충전, 연락처, 비밀번호, 회원권 연수)이 규칙을 위반할 때 발생
 */
public class InvalidAccountUpdateException extends DomainException {

    private InvalidAccountUpdateException(ErrorCode errorCode, String reason) {
        super(errorCode, reason);
    }

    public static InvalidAccountUpdateException topUp(String reason) {
        return new InvalidAccountUpdateException(ErrorCode.INVALID_TOP_UP, reason);
    }

    public static InvalidAccountUpdateException contact(String reason) {
        return new InvalidAccountUpdateException(ErrorCode.INVALID_CONTACT, reason);
    }

    public static InvalidAccountUpdateException password(String reason) {
        return new InvalidAccountUpdateException(ErrorCode.INVALID_PASSWORD, reason);
    }

    public static InvalidAccountUpdateException membershipYears(int years) {
        return new InvalidAccountUpdateException(ErrorCode.INVALID_MEMBERSHIP_YEARS, "requested " + years);
    }
}

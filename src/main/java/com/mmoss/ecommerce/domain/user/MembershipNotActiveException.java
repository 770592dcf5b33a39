package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 활성 회원권이 없는 상태에서 해지를 요청할 때 발생
 */
public class MembershipNotActiveException extends DomainException {

    public MembershipNotActiveException(String email) {
        super(ErrorCode.MEMBERSHIP_NOT_ACTIVE, email);
    }
}

package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 로그인 실패 (이메일 없음 또는 비밀번호 불일치)
 *
 * 두 경우를 구분하지 않고 같은 메시지를 사용한다.
 */
public class AuthenticationFailedException extends DomainException {

    public AuthenticationFailedException() {
        super(ErrorCode.AUTHENTICATION_FAILED);
    }
}

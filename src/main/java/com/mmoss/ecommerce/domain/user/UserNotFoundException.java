package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;

/**
 * 이메일로 사용자를 찾을 수 없을 때 발생
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(String email) {
        super(ErrorCode.USER_NOT_FOUND, email);
    }
}

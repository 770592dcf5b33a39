package com.mmoss.ecommerce.application.common;

import com.mmoss.ecommerce.common.exception.ApplicationException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import com.mmoss.ecommerce.domain.user.User;

/**
 * 역할 기반 접근 검증
 */
public final class AccessGuard {

    private AccessGuard() {
        throw new AssertionError("AccessGuard는 인스턴스화할 수 없습니다");
    }

    /**
     * @throws ApplicationException 로그인하지 않았거나 관리자가 아닌 경우
     */
    public static void requireAdmin(User user) {
        if (user == null || !user.isAdmin()) {
            throw new ApplicationException(ErrorCode.ACCESS_DENIED, "administrator only");
        }
    }

    /**
     * @throws ApplicationException 로그인하지 않았거나 고객이 아닌 경우
     */
    public static void requireCustomer(User user) {
        if (user == null || !user.isCustomer()) {
            throw new ApplicationException(ErrorCode.ACCESS_DENIED, "customers only");
        }
    }
}

package com.mmoss.ecommerce.presentation.console;

import com.mmoss.ecommerce.domain.cart.Cart;
import com.mmoss.ecommerce.domain.user.User;
import lombok.Getter;

/**
 * ShopSession - 로그인 세션 (현재 사용자와 장바구니)
 *
 * 모든 메뉴 동작에 명시적으로 전달된다. 로그인마다 새 장바구니로 시작한다.
 */
@Getter
public class ShopSession {

    private final User user;
    private final Cart cart;

    public ShopSession(User user) {
        if (user == null) {
            throw new IllegalArgumentException("Session user is required");
        }
        this.user = user;
        this.cart = new Cart();
    }
}

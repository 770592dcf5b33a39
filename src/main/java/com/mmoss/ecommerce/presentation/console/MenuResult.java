package com.mmoss.ecommerce.presentation.console;

/**
 * 하위 메뉴 종료 후 이동할 위치
 */
public enum MenuResult {
    /** 이전 메뉴로 ("0") */
    BACK,
    /** 메인 메뉴로 ("M") */
    MAIN,
    /** 로그아웃 */
    LOGOUT
}

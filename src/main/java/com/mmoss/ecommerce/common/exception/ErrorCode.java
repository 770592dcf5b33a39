package com.mmoss.ecommerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 사용자 표시 메시지 정의
 * - 콘솔에서 계속 진행 가능한 오류인지 여부 표시
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 메시지는 콘솔 사용자에게 그대로 노출되므로 영어로 작성한다.
 */
public enum ErrorCode {

    // ========== Domain Layer Errors ==========

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "User not found", true),
    AUTHENTICATION_FAILED("DOMAIN_USER_AUTHENTICATION_FAILED", "Invalid email or password", true),
    INSUFFICIENT_FUNDS("DOMAIN_USER_INSUFFICIENT_FUNDS", "Insufficient funds", true),
    INVALID_TOP_UP("DOMAIN_USER_INVALID_TOP_UP", "Invalid top-up amount", true),
    INVALID_CONTACT("DOMAIN_USER_INVALID_CONTACT", "Invalid contact details", true),
    INVALID_PASSWORD("DOMAIN_USER_INVALID_PASSWORD", "Password change rejected", true),
    MEMBERSHIP_NOT_ACTIVE("DOMAIN_USER_MEMBERSHIP_NOT_ACTIVE", "No active VIP membership", true),
    INVALID_MEMBERSHIP_YEARS("DOMAIN_USER_INVALID_MEMBERSHIP_YEARS", "Membership years must be at least 1", true),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "Product not found", true),
    DUPLICATE_PRODUCT("DOMAIN_PRODUCT_DUPLICATE", "A product with this SKU already exists", true),
    INVALID_PRODUCT("DOMAIN_PRODUCT_INVALID", "Invalid product data", true),
    CATEGORY_LIMIT_EXCEEDED("DOMAIN_PRODUCT_CATEGORY_LIMIT_EXCEEDED", "Category limit reached", true),
    OUT_OF_STOCK("DOMAIN_PRODUCT_OUT_OF_STOCK", "Not enough stock", true),

    // Cart Domain
    EMPTY_CART("DOMAIN_CART_EMPTY", "Your cart is empty", true),
    CART_LIMIT_EXCEEDED("DOMAIN_CART_LIMIT_EXCEEDED", "Cart limit exceeded", true),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "Invalid quantity", true),
    CART_LINE_NOT_FOUND("DOMAIN_CART_LINE_NOT_FOUND", "Item is not in your cart", true),

    // Order Domain
    INVALID_ADDRESS("DOMAIN_ORDER_INVALID_ADDRESS", "A delivery address is required", true),
    STORE_NOT_FOUND("DOMAIN_ORDER_STORE_NOT_FOUND", "Pickup store not found", true),
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "Order not found", true),

    // Promotion Domain
    INVALID_PROMO("DOMAIN_PROMOTION_INVALID", "Promotion code not applied", true),

    // ========== Application Layer Errors ==========

    ACCESS_DENIED("APP_ACCESS_DENIED", "This action is not available for your account", true),

    // ========== System Errors ==========

    PERSISTENCE_FAILURE("SYSTEM_PERSISTENCE_FAILURE", "Could not save or load data", true),
    STARTUP_FAILURE("SYSTEM_STARTUP_FAILURE", "Data files could not be prepared", false);

    private final String code;
    private final String message;
    private final boolean recoverable;

    ErrorCode(String code, String message, boolean recoverable) {
        this.code = code;
        this.message = message;
        this.recoverable = recoverable;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}

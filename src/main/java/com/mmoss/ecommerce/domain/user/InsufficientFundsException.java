package com.mmoss.ecommerce.domain.user;

import com.mmoss.ecommerce.common.exception.DomainException;
import com.mmoss.ecommerce.common.exception.ErrorCode;
import com.mmoss.ecommerce.domain.common.vo.Money;
import lombok.Getter;

/**
 * InsufficientFundsException - 잔액 부족 예외
 *
 * 발생 조건:
 * - 결제 총액이 고객 잔액보다 큰 경우
 * - VIP 회원권 구매 비용이 잔액보다 큰 경우
 */
@Getter
public class InsufficientFundsException extends DomainException {

    private final Money required;
    private final Money available;

    public InsufficientFundsException(Money required, Money available) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("required %s, available %s", required.format(), available.format()));
        this.required = required;
        this.available = available;
    }

    public Money getShortfall() {
        return required.subtractOrZero(available);
    }
}

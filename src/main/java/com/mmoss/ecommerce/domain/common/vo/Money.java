package com.mmoss.ecommerce.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Money Value Object
 *
 * 달러 금액을 나타내는 값 객체입니다.
 * 음수 금액을 허용하지 않으며, 모든 금액 계산은 이 객체를 통해 수행됩니다.
 *
 * 사용처:
 * - Product (price, memberPrice)
 * - User (funds)
 * - Order / OrderLine (subtotal, discounts, deliveryFee, total, unitPrice)
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 소수점 둘째 자리 고정, 반올림은 HALF_UP
 * - 0 이상의 금액만 허용
 * - equals/hashCode는 scale 정규화된 값 기준
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    /**
     * Money 객체를 생성합니다.
     *
     * @param amount 금액 (0 이상이어야 함)
     * @throws IllegalArgumentException amount가 null이거나 음수인 경우
     */
    public Money(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal scaled = amount.setScale(SCALE, ROUNDING);
        if (scaled.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount.toPlainString());
        }
        this.amount = scaled;
    }

    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    /**
     * 문자열 금액을 파싱합니다. 앞의 "$"와 천 단위 구분자는 허용합니다.
     *
     * @throws IllegalArgumentException 숫자가 아니거나 음수인 경우
     */
    public static Money of(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        String normalized = amount.trim().replace("$", "").replace(",", "");
        try {
            return new Money(new BigDecimal(normalized));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid amount: " + amount, e);
        }
    }

    public static Money ofCents(long cents) {
        return new Money(BigDecimal.valueOf(cents, SCALE));
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return new Money(this.amount.add(other.amount));
    }

    /**
     * 두 금액을 뺍니다.
     *
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        BigDecimal result = this.amount.subtract(other.amount);
        if (result.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Result cannot be negative: %s - %s", this.amount.toPlainString(), other.amount.toPlainString())
            );
        }
        return new Money(result);
    }

    /**
     * 두 금액을 빼되 결과가 음수이면 0을 반환합니다.
     */
    public Money subtractOrZero(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        BigDecimal result = this.amount.subtract(other.amount);
        return result.signum() < 0 ? ZERO : new Money(result);
    }

    /**
     * 수량만큼 곱합니다.
     *
     * @throws IllegalArgumentException quantity < 0인 경우
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * 백분율 금액을 계산합니다. 예: 39.98의 5% = 2.00
     *
     * @param percent 0 이상의 백분율
     */
    public Money percentage(int percent) {
        if (percent < 0) {
            throw new IllegalArgumentException("Percentage cannot be negative: " + percent);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(percent)).divide(ONE_HUNDRED, SCALE, ROUNDING));
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return compareTo(other) >= 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    /**
     * CSV 저장용 문자열 (예: "12.30")
     */
    public String toPlainString() {
        return amount.toPlainString();
    }

    /**
     * 화면 표시용 문자열 (예: "$1,234.50")
     */
    public String format() {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return "Money(" + amount.toPlainString() + ")";
    }
}

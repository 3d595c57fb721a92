package kr.hhplus.be.reconciliation.domain.common;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 금액을 나타내는 Value Object
 * - 소수점 2자리(센트 단위)로 정규화
 * - 불변 객체로 구현하여 안전한 가격 계산을 보장
 */
public final class Money implements Serializable {

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;

    public Money(BigDecimal amount) {
        Objects.requireNonNull(amount, "금액은 필수입니다");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("금액은 0 이상이어야 합니다");
        }
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO);
    }

    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    public static Money of(String amount) {
        return new Money(new BigDecimal(amount));
    }

    /**
     * null 허용 변환 (DB 컬럼 → 도메인)
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? null : new Money(amount);
    }

    // 금액 연산
    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money add(BigDecimal amount) {
        return new Money(this.amount.add(amount));
    }

    public Money multiply(int multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("곱셈 인수는 0 이상이어야 합니다");
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(multiplier)));
    }

    /**
     * 비율 계산 (예: 10 → 10%)
     */
    public Money percentage(BigDecimal percent) {
        return new Money(this.amount.multiply(percent).divide(HUNDRED, SCALE, RoundingMode.HALF_UP));
    }

    public Money divide(int divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("나눗셈 인수는 0보다 커야 합니다");
        }
        return new Money(this.amount.divide(BigDecimal.valueOf(divisor), SCALE, RoundingMode.HALF_UP));
    }

    // 비교 연산
    public boolean isZero() {
        return this.amount.signum() == 0;
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    // Getter
    public BigDecimal amount() {
        return amount;
    }

    // Object methods
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "$" + amount.toPlainString();
    }
}

package kr.hhplus.be.reconciliation.domain.seat;

import kr.hhplus.be.reconciliation.domain.common.Money;

import java.math.BigDecimal;

/**
 * 공연장 단위 가격 마크업 (팩 총액에 적용)
 */
public record PriceMarkup(MarkupType type, BigDecimal value) {

    public enum MarkupType {
        PERCENTAGE,
        FLAT
    }

    public PriceMarkup {
        if (type == null) {
            throw new IllegalArgumentException("마크업 유형은 필수입니다");
        }
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("마크업 값은 0 이상이어야 합니다");
        }
    }

    public static PriceMarkup none() {
        return new PriceMarkup(MarkupType.FLAT, BigDecimal.ZERO);
    }

    public static PriceMarkup percentage(String value) {
        return new PriceMarkup(MarkupType.PERCENTAGE, new BigDecimal(value));
    }

    public static PriceMarkup flat(String value) {
        return new PriceMarkup(MarkupType.FLAT, new BigDecimal(value));
    }

    public Money applyTo(Money packTotal) {
        if (packTotal == null) {
            return null;
        }
        return switch (type) {
            case PERCENTAGE -> packTotal.add(packTotal.percentage(value));
            case FLAT -> packTotal.add(value);
        };
    }
}

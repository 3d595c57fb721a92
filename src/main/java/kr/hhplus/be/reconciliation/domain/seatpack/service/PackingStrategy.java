package kr.hhplus.be.reconciliation.domain.seatpack.service;

/**
 * 연속 좌석 구간에서 팩을 만드는 방식
 */
public enum PackingStrategy {

    MAXIMAL("maximal", "구간 전체를 하나의 팩으로"),
    EXHAUSTIVE("exhaustive", "최소 크기 이상의 모든 부분 구간을 팩으로");

    private final String code;
    private final String description;

    PackingStrategy(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static PackingStrategy fromCode(String code) {
        for (PackingStrategy strategy : values()) {
            if (strategy.code.equalsIgnoreCase(code) || strategy.name().equalsIgnoreCase(code)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("packing strategy 는 maximal 또는 exhaustive 여야 합니다: " + code);
    }
}

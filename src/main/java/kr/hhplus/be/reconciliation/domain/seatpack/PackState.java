package kr.hhplus.be.reconciliation.domain.seatpack;

/**
 * 팩 생애주기 상태 (팩이 어떻게 생겨났는지, 또는 어떻게 끝났는지)
 */
public enum PackState {

    CREATE("신규"),
    SPLIT("분할"),
    MERGE("병합"),
    SHRINK("축소"),
    DELIST("내림"),
    TRANSFORMED("변환됨");

    private final String displayName;

    PackState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    // 상태 전환 가능 여부 체크
    public boolean canTransitionTo(PackState target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case CREATE -> target == SPLIT || target == MERGE || target == SHRINK
                    || target == DELIST || target == TRANSFORMED;
            case SPLIT, MERGE, SHRINK -> target == DELIST || target == TRANSFORMED;
            case DELIST -> target == CREATE; // 수동 재활성화만 허용
            case TRANSFORMED -> false; // 최종 상태
        };
    }

    /**
     * 같은 좌석 구성이 다시 나타났을 때 기존 기록을 새 생애로 열 수 있는 상태.
     * 생애 안에서의 전환 규칙(canTransitionTo)과 별개로, 끝난 생애(DELIST/TRANSFORMED)만 다시 열린다.
     */
    public boolean canReopen() {
        return this == DELIST || this == TRANSFORMED;
    }

    // 생성 계열 상태 (POS 에 올라가야 하는 팩)
    public boolean isOrigin() {
        return this == CREATE || this == SPLIT || this == MERGE || this == SHRINK;
    }

    // 내림 계열 상태 (POS 에서 내려가야 하는 팩)
    public boolean isDelisted() {
        return this == DELIST || this == TRANSFORMED;
    }
}

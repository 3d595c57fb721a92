package kr.hhplus.be.reconciliation.domain.seatpack;

/**
 * 외부 POS 에서 마지막으로 확인된 리스팅 상태
 */
public enum PosStatus {

    ACTIVE("판매중", "POS 에 리스팅되어 있는 상태"),
    INACTIVE("내림", "POS 에서 리스팅이 제거된 상태"),
    PENDING("대기", "POS 반영을 기다리는 상태"),
    FAILED("실패", "마지막 POS 반영이 실패한 상태"),
    SUSPENDED("보류", "관리자 홀드로 판매가 중지된 상태"),
    UNDER_REVIEW("검토중", "수동 검토가 필요한 상태");

    private final String displayName;
    private final String description;

    PosStatus(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    // 동기화 엔진이 처리해야 하는 상태 여부
    public boolean awaitsSync() {
        return this == PENDING || this == FAILED;
    }
}

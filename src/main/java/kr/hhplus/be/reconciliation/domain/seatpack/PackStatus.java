package kr.hhplus.be.reconciliation.domain.seatpack;

/**
 * 우리 시스템 기준 팩 운영 상태
 */
public enum PackStatus {
    ACTIVE("활성"),
    INACTIVE("비활성");

    private final String displayName;

    PackStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

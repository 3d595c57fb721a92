package kr.hhplus.be.reconciliation.domain.seatpack;

public enum DelistReason {
    MANUAL_DELIST("수동 내림"),
    PERFORMANCE_DISABLED("공연 POS 비활성화"),
    TRANSFORMED("다른 팩으로 변환"),
    VANISHED("좌석 소멸"),
    STRUCTURE_CHANGE("좌석 번호 체계 변경"),
    ADMIN_HOLD("관리자 홀드");

    private final String displayName;

    DelistReason(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    // 운영자가 직접 내린 팩 (자동 재생성/재활성화 대상 아님)
    public boolean isOperatorHold() {
        return this == MANUAL_DELIST || this == ADMIN_HOLD;
    }
}

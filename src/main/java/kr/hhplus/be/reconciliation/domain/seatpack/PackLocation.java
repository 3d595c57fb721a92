package kr.hhplus.be.reconciliation.domain.seatpack;

/**
 * 팩의 위치 정보 (공연 / 레벨 / 구역 / 섹션 / 열)
 */
public record PackLocation(
        String performanceId,
        String levelId,
        String zoneId,
        String sectionId,
        String sectionName,
        String rowLabel
) {

    public PackLocation {
        if (performanceId == null || performanceId.isBlank()) {
            throw new IllegalArgumentException("공연 ID는 필수입니다");
        }
    }

    /**
     * 좌석 겹침 계산용 버킷 키 (구역 + 열)
     */
    public String bucketKey() {
        return zoneId + "|" + rowLabel;
    }

    public boolean isResolvable() {
        return notBlank(zoneId) && notBlank(sectionName) && notBlank(rowLabel);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public String toDisplayString() {
        return String.format("구역[%s] 섹션[%s] 열[%s]", zoneId, sectionName, rowLabel);
    }
}

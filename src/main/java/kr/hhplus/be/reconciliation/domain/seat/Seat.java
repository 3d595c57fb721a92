package kr.hhplus.be.reconciliation.domain.seat;

import kr.hhplus.be.reconciliation.domain.common.Money;

/**
 * 스크래핑으로 수집된 개별 좌석 (매 스크랩마다 새로 생성되는 입력 데이터)
 *
 * @param seatId      소스 기준 좌석 고유 ID
 * @param levelId     층(레벨) ID, 없으면 null
 * @param zoneId      구역 ID
 * @param sectionId   섹션 ID (null이면 팩 생성 대상에서 제외)
 * @param sectionName POS 에 노출될 섹션 이름
 * @param rowLabel    열 라벨
 * @param seatLabel   좌석 번호 라벨 (예: "12", "A12")
 * @param available   판매 가능 여부
 * @param price       좌석 단가, 알 수 없으면 null
 */
public record Seat(
        String seatId,
        String levelId,
        String zoneId,
        String sectionId,
        String sectionName,
        String rowLabel,
        String seatLabel,
        boolean available,
        Money price,
        boolean wheelchairAccessible
) {

    public Seat {
        if (seatId == null || seatId.isBlank()) {
            throw new IllegalArgumentException("좌석 ID는 필수입니다");
        }
        if (seatId.contains(",")) {
            throw new IllegalArgumentException("좌석 ID에 쉼표를 쓸 수 없습니다: " + seatId);
        }
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("구역 ID는 필수입니다");
        }
        if (rowLabel == null || rowLabel.isBlank()) {
            throw new IllegalArgumentException("열 라벨은 필수입니다");
        }
        if (seatLabel == null || seatLabel.isBlank()) {
            throw new IllegalArgumentException("좌석 번호는 필수입니다");
        }
    }

    public static Seat available(String seatId, String zoneId, String sectionId, String rowLabel,
                                 String seatLabel, Money price) {
        return new Seat(seatId, null, zoneId, sectionId, sectionId, rowLabel, seatLabel, true, price, false);
    }

    public boolean hasSection() {
        return sectionId != null && !sectionId.isBlank();
    }
}

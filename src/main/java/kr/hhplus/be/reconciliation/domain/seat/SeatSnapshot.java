package kr.hhplus.be.reconciliation.domain.seat;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 공연별 마지막 스크랩 입력 (좌석 + 팩 생성 옵션)
 * 공연장 번호 체계가 바뀌었을 때 스크랩 없이 팩을 다시 만들기 위해 보관한다.
 *
 * @param sectionSchemes  섹션 ID → 번호 체계 코드
 * @param minPackSize     null 이면 설정값
 * @param packingStrategy null 이면 설정값
 */
public record SeatSnapshot(
        String performanceId,
        String source,
        List<Seat> seats,
        Map<String, String> sectionSchemes,
        Integer minPackSize,
        String packingStrategy,
        PriceMarkup markup,
        LocalDateTime capturedAt
) {

    public SeatSnapshot {
        Objects.requireNonNull(performanceId, "공연 ID는 필수입니다");
        seats = seats == null ? List.of() : List.copyOf(seats);
        sectionSchemes = sectionSchemes == null ? Map.of() : Map.copyOf(sectionSchemes);
    }
}

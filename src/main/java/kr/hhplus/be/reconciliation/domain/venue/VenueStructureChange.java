package kr.hhplus.be.reconciliation.domain.venue;

import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;

import java.time.LocalDateTime;

/**
 * 공연장 좌석 번호 체계 변경 감지 결과
 */
public record VenueStructureChange(
        String venueId,
        NumberingScheme previousScheme,
        NumberingScheme currentScheme,
        LocalDateTime detectedAt
) {
}

package kr.hhplus.be.reconciliation.application.port.in;

import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;

import java.util.List;

/**
 * 공연장 좌석 번호 체계 변경 처리
 */
public interface VenueStructureUseCase {

    /**
     * @param affectedPerformanceIds 공연장에 속한 공연 전체 (팩을 다시 만들어야 하는 대상)
     * @param deferredPackIds        다른 작업이 점유 중이라 내리지 못한 팩
     */
    record StructureChangeResult(
            String venueId,
            boolean changed,
            NumberingScheme previousScheme,
            NumberingScheme currentScheme,
            List<String> affectedPerformanceIds,
            int delistedPacks,
            List<String> deferredPackIds
    ) {
        public StructureChangeResult {
            affectedPerformanceIds = List.copyOf(affectedPerformanceIds);
            deferredPackIds = List.copyOf(deferredPackIds);
        }

        public static StructureChangeResult unchanged(String venueId, NumberingScheme scheme) {
            return new StructureChangeResult(venueId, false, scheme, scheme, List.of(), 0, List.of());
        }
    }

    /**
     * 새로 판별된 번호 체계를 기록하고, 바뀌었으면 공연장 전체 활성 팩을 내린다.
     * 팩 재생성은 호출한 쪽이 affectedPerformanceIds 를 보고 진행한다.
     */
    StructureChangeResult applyDetectedScheme(String venueId, NumberingScheme detected);
}

package kr.hhplus.be.reconciliation.application.port.in;

import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;
import kr.hhplus.be.reconciliation.domain.seat.Seat;
import kr.hhplus.be.reconciliation.domain.seatpack.service.WorkflowScenario;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 스크랩 결과 반영 Use Case (좌석 → 팩 생성 → 비교 → 계보 저장)
 */
public interface ReconciliationUseCase {

    /**
     * @param performance     공연 정보 (null 이면 이미 등록된 공연이어야 한다)
     * @param numberingScheme 공연장 번호 체계 코드 (null 이면 좌석으로 판별)
     * @param sectionSchemes  섹션별 번호 체계 코드
     * @param minPackSize     null 이면 설정값
     * @param packingStrategy null 이면 설정값
     */
    record ReconcileCommand(
            String performanceId,
            String source,
            PerformanceInfo performance,
            List<Seat> seats,
            String numberingScheme,
            Map<String, String> sectionSchemes,
            Integer minPackSize,
            String packingStrategy,
            PriceMarkup markup
    ) {}

    record PerformanceInfo(
            String venueId,
            String eventName,
            LocalDateTime eventDate,
            String venueName,
            String city,
            String stateProvince,
            String countryCode
    ) {}

    record WorkflowResult(
            boolean success,
            String performanceId,
            WorkflowScenario scenario,
            int processed,
            int created,
            int updated,
            int delisted,
            int resynced,
            boolean structureChanged,
            double executionSeconds,
            List<String> errors,
            List<String> warnings
    ) {
        public static WorkflowResult failed(String performanceId, double executionSeconds, String error) {
            return new WorkflowResult(false, performanceId, null, 0, 0, 0, 0, 0, false,
                    executionSeconds, List.of(error), List.of());
        }
    }

    WorkflowResult reconcile(ReconcileCommand command);
}

package kr.hhplus.be.reconciliation.application.port.in;

import java.util.List;

/**
 * POS 동기화 Use Case
 */
public interface PosSyncUseCase {

    record PosSyncResult(
            boolean success,
            String operationId,
            String performanceId,
            int totalPacks,
            int synced,
            int failed,
            int skipped,
            double executionSeconds,
            List<String> errors
    ) {}

    /**
     * 동기화 대기 팩을 배치 단위로 POS 에 반영한다.
     * 개별 팩 실패로 예외를 던지지 않고 항상 요약 결과를 반환한다.
     *
     * @param performanceId null 이면 전체 공연
     */
    PosSyncResult syncPendingPacks(String performanceId);
}

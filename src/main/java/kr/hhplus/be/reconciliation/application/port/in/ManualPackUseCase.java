package kr.hhplus.be.reconciliation.application.port.in;

import java.util.List;

/**
 * 운영자 수동 작업 Use Case
 */
public interface ManualPackUseCase {

    record ManualDelistCommand(String packId, String operator, String reason) {}

    record ReactivateCommand(String packId, String operator) {}

    record AdminHoldCommand(String packId, String operator, String notes) {}

    record PerformanceToggleResult(String performanceId, boolean posEnabled, int affectedPacks) {}

    SeatPackView manualDelist(ManualDelistCommand command);

    SeatPackView reactivate(ReactivateCommand command);

    SeatPackView adminHold(AdminHoldCommand command);

    /**
     * 재시도 한도를 초과한 팩을 다시 동기화 대기열에 넣는다
     */
    SeatPackView requeue(String packId, String operator);

    PerformanceToggleResult setPerformancePosEnabled(String performanceId, boolean enabled, String operator);

    // 조회
    List<SeatPackView> findDelistable(String performanceId);

    List<SeatPackView> findReactivatable(String performanceId);

    List<SeatPackView> findRecentManualDelists();

    /**
     * 재시도 한도를 넘겨 자동 동기화에서 빠진 팩 (requeue 대상)
     */
    List<SeatPackView> findRetryExhausted();

    List<SeatPackView> findChildren(String parentPackId);
}

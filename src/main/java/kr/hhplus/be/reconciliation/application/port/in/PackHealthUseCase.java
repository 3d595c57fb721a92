package kr.hhplus.be.reconciliation.application.port.in;

import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackStatistics;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 팩 저장소/동기화 상태 점검
 */
public interface PackHealthUseCase {

    enum HealthStatus {
        HEALTHY,
        WARNING,
        CRITICAL
    }

    record SeatPackHealth(
            HealthStatus status,
            SeatPackStatistics statistics,
            long unresolvedFailedRollbacks,
            List<String> issues,
            LocalDateTime checkedAt
    ) implements Serializable {}

    record FailedRollbackView(
            Long id,
            String operationId,
            String packId,
            String actionType,
            String actionData,
            String errorMessage,
            LocalDateTime createdAt,
            LocalDateTime resolvedAt,
            String resolvedBy,
            String resolutionNotes
    ) {}

    SeatPackHealth checkHealth();

    List<FailedRollbackView> findUnresolvedRollbacks();

    FailedRollbackView resolveRollback(Long id, String operator, String notes);
}

package kr.hhplus.be.reconciliation.domain.seatpack;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 좌석 팩 리포지토리 (팩 계보 저장소)
 */
public interface SeatPackRepository {

    // 기본 CRUD (물리 삭제 없음)

    /**
     * 버전 검사 후 저장. 저장된 버전과 다르면 {@link jakarta.persistence.OptimisticLockException}.
     * 리스 필드(locked_by / locked_at)는 이 경로로 변경되지 않는다.
     */
    SeatPack save(SeatPack pack);

    Optional<SeatPack> findById(SeatPackId id);

    List<SeatPack> findAllById(Collection<SeatPackId> ids);

    // 비교/동기화용 조회
    List<SeatPack> findActiveByPerformanceId(String performanceId);

    List<SeatPack> findActiveByPerformanceIds(Collection<String> performanceIds);

    /**
     * POS 동기화 대기열 (미동기화 + 시도 횟수 한도 미만, 시도 횟수 → 생성 시각 순)
     *
     * @param performanceId null 이면 전체 공연
     */
    List<SeatPack> findSyncQueue(String performanceId, int maxAttempts, int limit);

    List<SeatPack> findRetryExhausted(int maxAttempts);

    // 수동 작업용 조회
    List<SeatPack> findManuallyDelistable(String performanceId);

    List<SeatPack> findManuallyReactivatable(String performanceId);

    List<SeatPack> findRecentManualDelists(LocalDateTime since);

    List<SeatPack> findChildren(SeatPackId parentId);

    // 리스 (조건부 UPDATE)
    boolean acquireLease(SeatPackId id, String holderId, LocalDateTime now);

    boolean releaseLease(SeatPackId id, String holderId);

    int clearStaleLeases(LocalDateTime lockedBefore);

    long countStaleLeases(LocalDateTime lockedBefore);

    // 중단된 POS 작업 정리
    int failStaleOperations(LocalDateTime startedBefore);

    // 통계
    SeatPackStatistics statistics(LocalDateTime staleLeaseThreshold, int highRetryThreshold);
}

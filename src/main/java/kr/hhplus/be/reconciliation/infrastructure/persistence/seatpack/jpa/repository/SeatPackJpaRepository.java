package kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.repository;

import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.PackStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosOperationStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosStatus;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.entity.SeatPackJpaEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface SeatPackJpaRepository extends JpaRepository<SeatPackJpaEntity, String> {

    List<SeatPackJpaEntity> findByPerformanceIdAndPackStatus(String performanceId, PackStatus packStatus);

    List<SeatPackJpaEntity> findByPerformanceIdInAndPackStatus(Collection<String> performanceIds, PackStatus packStatus);

    // 동기화 대기열 (리스가 잡힌 팩 제외, 시도 횟수 적은 순 → 오래된 순)
    @Query("SELECT p FROM SeatPackJpaEntity p " +
            "WHERE p.syncedToPos = false " +
            "AND p.posSyncAttempts < :maxAttempts " +
            "AND p.lockedBy IS NULL " +
            "ORDER BY p.posSyncAttempts ASC, p.createdAt ASC")
    List<SeatPackJpaEntity> findSyncQueue(
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable);

    @Query("SELECT p FROM SeatPackJpaEntity p " +
            "WHERE p.syncedToPos = false " +
            "AND p.posSyncAttempts < :maxAttempts " +
            "AND p.lockedBy IS NULL " +
            "AND p.performanceId = :performanceId " +
            "ORDER BY p.posSyncAttempts ASC, p.createdAt ASC")
    List<SeatPackJpaEntity> findSyncQueueByPerformance(
            @Param("performanceId") String performanceId,
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable);

    List<SeatPackJpaEntity> findByPosStatusAndPosSyncAttemptsGreaterThanEqual(PosStatus posStatus, int attempts);

    // 수동 작업용
    @Query("SELECT p FROM SeatPackJpaEntity p " +
            "WHERE p.performanceId = :performanceId " +
            "AND p.packStatus = :active " +
            "AND p.posStatus IN :posStatuses " +
            "AND p.packState IN :states " +
            "ORDER BY p.zoneId, p.rowLabel, p.startSeat")
    List<SeatPackJpaEntity> findManuallyDelistable(
            @Param("performanceId") String performanceId,
            @Param("active") PackStatus active,
            @Param("posStatuses") Collection<PosStatus> posStatuses,
            @Param("states") Collection<PackState> states);

    List<SeatPackJpaEntity> findByPerformanceIdAndManuallyDelistedTrueAndPackStateOrderByManuallyDelistedAtDesc(
            String performanceId, PackState packState);

    List<SeatPackJpaEntity> findByManuallyDelistedTrueAndManuallyDelistedAtAfterOrderByManuallyDelistedAtDesc(
            LocalDateTime since);

    // 원본 ID 가 포함된 후보 (정확한 일치는 어댑터에서 거른다)
    List<SeatPackJpaEntity> findBySourcePackIdsContaining(String packId);

    // 리스 (버전 증가 없음)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SeatPackJpaEntity p " +
            "SET p.lockedBy = :holderId, p.lockedAt = :now " +
            "WHERE p.id = :id " +
            "AND (p.lockedBy IS NULL OR p.lockedBy = :holderId)")
    int acquireLease(@Param("id") String id, @Param("holderId") String holderId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SeatPackJpaEntity p " +
            "SET p.lockedBy = NULL, p.lockedAt = NULL " +
            "WHERE p.id = :id AND p.lockedBy = :holderId")
    int releaseLease(@Param("id") String id, @Param("holderId") String holderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SeatPackJpaEntity p " +
            "SET p.lockedBy = NULL, p.lockedAt = NULL " +
            "WHERE p.lockedBy IS NOT NULL AND p.lockedAt < :lockedBefore")
    int clearStaleLeases(@Param("lockedBefore") LocalDateTime lockedBefore);

    // 진행 중으로 멈춘 작업 실패 처리 (버전 증가)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SeatPackJpaEntity p " +
            "SET p.posOperationStatus = :failed, p.version = p.version + 1 " +
            "WHERE p.posOperationStatus = :started AND p.lastPosSyncAttempt < :startedBefore")
    int failStaleOperations(
            @Param("started") PosOperationStatus started,
            @Param("failed") PosOperationStatus failed,
            @Param("startedBefore") LocalDateTime startedBefore);

    // 통계
    long countByPackStatus(PackStatus packStatus);

    long countByPosStatus(PosStatus posStatus);

    long countBySyncedToPosFalse();

    @Query("SELECT COUNT(p) FROM SeatPackJpaEntity p " +
            "WHERE p.syncedToPos = false AND p.packStatus = :packStatus AND p.packState IN :states")
    long countUnsyncedByStatusAndStates(
            @Param("packStatus") PackStatus packStatus,
            @Param("states") Collection<PackState> states);

    @Query("SELECT COUNT(p) FROM SeatPackJpaEntity p " +
            "WHERE p.syncedToPos = false AND p.packState IN :states")
    long countUnsyncedByStates(@Param("states") Collection<PackState> states);

    long countByPosSyncAttemptsGreaterThanEqual(int attempts);

    long countByLockedByIsNotNull();

    long countByLockedByIsNotNullAndLockedAtBefore(LocalDateTime lockedBefore);

    long countByPosOperationStatus(PosOperationStatus posOperationStatus);
}

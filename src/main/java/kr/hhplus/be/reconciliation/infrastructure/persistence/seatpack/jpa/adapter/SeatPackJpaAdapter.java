package kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.adapter;

import jakarta.persistence.OptimisticLockException;
import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seatpack.PackLocation;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.PackStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosOperationStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackStatistics;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.entity.SeatPackJpaEntity;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.repository.SeatPackJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SeatPackJpaAdapter implements SeatPackRepository {

    private static final String DELIMITER = ",";
    private static final EnumSet<PackState> ORIGIN_STATES =
            EnumSet.of(PackState.CREATE, PackState.SPLIT, PackState.MERGE, PackState.SHRINK);
    private static final EnumSet<PackState> DELISTED_STATES =
            EnumSet.of(PackState.DELIST, PackState.TRANSFORMED);

    private final SeatPackJpaRepository jpaRepository;

    @Override
    @Transactional(noRollbackFor = OptimisticLockException.class)
    public SeatPack save(SeatPack pack) {
        SeatPack.Snapshot s = pack.snapshot();
        SeatPackJpaEntity entity;

        Optional<SeatPackJpaEntity> existingEntity = jpaRepository.findById(s.id().value());

        if (existingEntity.isEmpty()) {
            // 신규 생성 (version 은 JPA 가 부여)
            entity = new SeatPackJpaEntity(
                    s.id().value(),
                    s.source(),
                    s.location().performanceId(),
                    s.location().levelId(),
                    s.location().zoneId(),
                    s.location().sectionId(),
                    s.location().sectionName(),
                    s.location().rowLabel(),
                    String.join(DELIMITER, s.seatIds()),
                    s.startSeat(),
                    s.endSeat(),
                    s.seatIds().size(),
                    s.wheelchairAccessible(),
                    s.createdAt()
            );
        } else {
            entity = existingEntity.get();

            // version 체크 (낙관적 락)
            if (!Objects.equals(entity.getVersion(), s.version())) {
                throw new OptimisticLockException(
                        "팩이 다른 작업에 의해 수정되었습니다: " + s.id().value()
                );
            }
        }

        applyState(entity, s);
        SeatPackJpaEntity savedEntity = jpaRepository.saveAndFlush(entity);
        return toDomain(savedEntity);
    }

    @Override
    public Optional<SeatPack> findById(SeatPackId id) {
        return jpaRepository.findById(id.value())
                .map(this::toDomain);
    }

    @Override
    public List<SeatPack> findAllById(Collection<SeatPackId> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findAllById(ids.stream().map(SeatPackId::value).toList())
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findActiveByPerformanceId(String performanceId) {
        return jpaRepository.findByPerformanceIdAndPackStatus(performanceId, PackStatus.ACTIVE)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findActiveByPerformanceIds(Collection<String> performanceIds) {
        if (performanceIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findByPerformanceIdInAndPackStatus(performanceIds, PackStatus.ACTIVE)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findSyncQueue(String performanceId, int maxAttempts, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<SeatPackJpaEntity> queue = performanceId == null
                ? jpaRepository.findSyncQueue(maxAttempts, page)
                : jpaRepository.findSyncQueueByPerformance(performanceId, maxAttempts, page);
        return queue.stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findRetryExhausted(int maxAttempts) {
        return jpaRepository.findByPosStatusAndPosSyncAttemptsGreaterThanEqual(PosStatus.FAILED, maxAttempts)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findManuallyDelistable(String performanceId) {
        return jpaRepository.findManuallyDelistable(performanceId, PackStatus.ACTIVE,
                        EnumSet.of(PosStatus.ACTIVE, PosStatus.PENDING), ORIGIN_STATES)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findManuallyReactivatable(String performanceId) {
        return jpaRepository
                .findByPerformanceIdAndManuallyDelistedTrueAndPackStateOrderByManuallyDelistedAtDesc(
                        performanceId, PackState.DELIST)
                .stream()
                .map(this::toDomain)
                .filter(SeatPack::isManuallyReactivatable)
                .toList();
    }

    @Override
    public List<SeatPack> findRecentManualDelists(LocalDateTime since) {
        return jpaRepository.findByManuallyDelistedTrueAndManuallyDelistedAtAfterOrderByManuallyDelistedAtDesc(since)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<SeatPack> findChildren(SeatPackId parentId) {
        return jpaRepository.findBySourcePackIdsContaining(parentId.value())
                .stream()
                .map(this::toDomain)
                .filter(pack -> pack.getSourcePackIds().contains(parentId.value()))
                .toList();
    }

    @Override
    @Transactional
    public boolean acquireLease(SeatPackId id, String holderId, LocalDateTime now) {
        return jpaRepository.acquireLease(id.value(), holderId, now) == 1;
    }

    @Override
    @Transactional
    public boolean releaseLease(SeatPackId id, String holderId) {
        return jpaRepository.releaseLease(id.value(), holderId) == 1;
    }

    @Override
    @Transactional
    public int clearStaleLeases(LocalDateTime lockedBefore) {
        return jpaRepository.clearStaleLeases(lockedBefore);
    }

    @Override
    public long countStaleLeases(LocalDateTime lockedBefore) {
        return jpaRepository.countByLockedByIsNotNullAndLockedAtBefore(lockedBefore);
    }

    @Override
    @Transactional
    public int failStaleOperations(LocalDateTime startedBefore) {
        return jpaRepository.failStaleOperations(PosOperationStatus.STARTED, PosOperationStatus.FAILED, startedBefore);
    }

    @Override
    public SeatPackStatistics statistics(LocalDateTime staleLeaseThreshold, int highRetryThreshold) {
        return new SeatPackStatistics(
                jpaRepository.count(),
                jpaRepository.countByPackStatus(PackStatus.ACTIVE),
                jpaRepository.countByPackStatus(PackStatus.INACTIVE),
                jpaRepository.countByPosStatus(PosStatus.PENDING),
                jpaRepository.countByPosStatus(PosStatus.FAILED),
                jpaRepository.countBySyncedToPosFalse(),
                jpaRepository.countUnsyncedByStatusAndStates(PackStatus.ACTIVE, ORIGIN_STATES),
                jpaRepository.countUnsyncedByStates(DELISTED_STATES),
                jpaRepository.countByPosSyncAttemptsGreaterThanEqual(highRetryThreshold),
                jpaRepository.countByLockedByIsNotNull(),
                jpaRepository.countByLockedByIsNotNullAndLockedAtBefore(staleLeaseThreshold),
                jpaRepository.countByPosOperationStatus(PosOperationStatus.STARTED),
                jpaRepository.countByPosOperationStatus(PosOperationStatus.FAILED)
        );
    }

    // === Private Helper Methods ===

    // 좌석 구성/위치/리스 컬럼은 건드리지 않는다
    private void applyState(SeatPackJpaEntity entity, SeatPack.Snapshot s) {
        entity.setSeatPrice(s.seatPrice() == null ? null : s.seatPrice().amount());
        entity.setTotalPrice(s.totalPrice() == null ? null : s.totalPrice().amount());
        entity.setPackStatus(s.packStatus());
        entity.setPosStatus(s.posStatus());
        entity.setPackState(s.packState());
        entity.setDelistReason(s.delistReason());
        entity.setSourcePackIds(s.sourcePackIds().isEmpty() ? null : String.join(DELIMITER, s.sourcePackIds()));
        entity.setSyncedToPos(s.syncedToPos());
        entity.setPosSyncAttempts(s.posSyncAttempts());
        entity.setLastPosSyncAttempt(s.lastPosSyncAttempt());
        entity.setPosSyncError(truncate(s.posSyncError(), 1000));
        entity.setPosListingId(s.posListingId());
        entity.setPosOperationId(s.posOperationId());
        entity.setPosOperationStatus(s.posOperationStatus());
        entity.setManuallyDelisted(s.manuallyDelisted());
        entity.setManuallyDelistedBy(s.manuallyDelistedBy());
        entity.setManuallyDelistedAt(s.manuallyDelistedAt());
        entity.setManuallyDelistedReason(truncate(s.manuallyDelistedReason(), 500));
        entity.setManuallyEnabledBy(s.manuallyEnabledBy());
        entity.setManuallyEnabledAt(s.manuallyEnabledAt());
    }

    private SeatPack toDomain(SeatPackJpaEntity entity) {
        return SeatPack.restore(new SeatPack.Snapshot(
                SeatPackId.of(entity.getId()),
                entity.getSource(),
                new PackLocation(entity.getPerformanceId(), entity.getLevelId(), entity.getZoneId(),
                        entity.getSectionId(), entity.getSectionName(), entity.getRowLabel()),
                split(entity.getSeatIds()),
                entity.getStartSeat(),
                entity.getEndSeat(),
                entity.isWheelchairAccessible(),
                Money.ofNullable(entity.getSeatPrice()),
                Money.ofNullable(entity.getTotalPrice()),
                entity.getPackStatus(),
                entity.getPosStatus(),
                entity.getPackState(),
                entity.getDelistReason(),
                split(entity.getSourcePackIds()),
                entity.isSyncedToPos(),
                entity.getPosSyncAttempts(),
                entity.getLastPosSyncAttempt(),
                entity.getPosSyncError(),
                entity.getPosListingId(),
                entity.getPosOperationId(),
                entity.getPosOperationStatus(),
                entity.isManuallyDelisted(),
                entity.getManuallyDelistedBy(),
                entity.getManuallyDelistedAt(),
                entity.getManuallyDelistedReason(),
                entity.getManuallyEnabledBy(),
                entity.getManuallyEnabledAt(),
                entity.getLockedBy(),
                entity.getLockedAt(),
                entity.getVersion() == null ? 0L : entity.getVersion(),
                entity.getCreatedAt()
        ));
    }

    private static List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.asList(joined.split(DELIMITER));
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

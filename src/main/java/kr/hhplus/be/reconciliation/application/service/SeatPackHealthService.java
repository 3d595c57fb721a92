package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackNotFoundException;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackStatistics;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import kr.hhplus.be.reconciliation.infrastructure.redis.config.RedisConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 팩 저장소 상태 점검
 *
 * CRITICAL: 처리되지 않은 롤백 실패 존재, 오래된 리스 50개 초과
 * WARNING : 미동기화 1000개 초과, POS 실패 100개 초과, 오래된 리스 10개 초과
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatPackHealthService implements PackHealthUseCase {

    static final long CRITICAL_STALE_LEASES = 50;
    static final long WARNING_STALE_LEASES = 10;
    static final long WARNING_UNSYNCED = 1000;
    static final long WARNING_POS_FAILED = 100;

    private final SeatPackRepository seatPackRepository;
    private final FailedRollbackRepository failedRollbackRepository;
    private final ReconciliationProperties properties;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.SEAT_PACK_HEALTH_CACHE, key = "'summary'")
    public SeatPackHealth checkHealth() {
        LocalDateTime now = LocalDateTime.now();
        SeatPackStatistics stats = seatPackRepository.statistics(
                now.minusMinutes(properties.getLease().getStaleAfterMinutes()),
                properties.getSync().getHighRetryThreshold());
        long unresolved = failedRollbackRepository.countUnresolved();

        List<String> critical = new ArrayList<>();
        List<String> warning = new ArrayList<>();

        if (unresolved > 0) {
            critical.add("처리되지 않은 롤백 실패 " + unresolved + "건");
        }
        if (stats.staleLeases() > CRITICAL_STALE_LEASES) {
            critical.add("오래된 리스 " + stats.staleLeases() + "건");
        } else if (stats.staleLeases() > WARNING_STALE_LEASES) {
            warning.add("오래된 리스 " + stats.staleLeases() + "건");
        }
        if (stats.unsynced() > WARNING_UNSYNCED) {
            warning.add("POS 미동기화 팩 " + stats.unsynced() + "건");
        }
        if (stats.posFailed() > WARNING_POS_FAILED) {
            warning.add("POS 반영 실패 팩 " + stats.posFailed() + "건");
        }

        HealthStatus status = !critical.isEmpty()
                ? HealthStatus.CRITICAL
                : !warning.isEmpty() ? HealthStatus.WARNING : HealthStatus.HEALTHY;

        List<String> issues = new ArrayList<>(critical);
        issues.addAll(warning);
        if (status != HealthStatus.HEALTHY) {
            log.warn("[헬스체크] 상태: {}, 문제: {}", status, issues);
        }
        return new SeatPackHealth(status, stats, unresolved, List.copyOf(issues), now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FailedRollbackView> findUnresolvedRollbacks() {
        return failedRollbackRepository.findUnresolved().stream()
                .map(SeatPackHealthService::toView)
                .toList();
    }

    @Override
    @Transactional
    @CacheEvict(value = RedisConfig.SEAT_PACK_HEALTH_CACHE, allEntries = true)
    public FailedRollbackView resolveRollback(Long id, String operator, String notes) {
        FailedRollback failedRollback = failedRollbackRepository.findById(id)
                .orElseThrow(() -> new FailedRollbackNotFoundException(id));
        failedRollback.resolve(operator, notes, LocalDateTime.now());
        FailedRollback saved = failedRollbackRepository.markResolved(failedRollback);
        log.info("[헬스체크] 롤백 실패 처리 완료 - id: {}, operator: {}", id, operator);
        return toView(saved);
    }

    private static FailedRollbackView toView(FailedRollback f) {
        return new FailedRollbackView(f.getId(), f.getOperationId(), f.getPackId(), f.getActionType(),
                f.getActionData(), f.getErrorMessage(), f.getCreatedAt(), f.getResolvedAt(),
                f.getResolvedBy(), f.getResolutionNotes());
    }
}

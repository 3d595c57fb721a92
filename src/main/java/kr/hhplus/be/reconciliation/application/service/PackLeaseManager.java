package kr.hhplus.be.reconciliation.application.service;

import jakarta.persistence.OptimisticLockException;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackLeaseConflictException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackVersionConflictException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.SeatPackNotFoundException;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 팩 단위 리스(배타적 점유) 및 낙관적 락 재시도 관리
 *
 * [리스]
 * - acquire: 아무도 보유하지 않았거나 같은 보유자일 때만 성공 (DB 조건부 UPDATE)
 * - release: 보유자 본인만 해제 가능
 * - 오래된 리스는 주기적으로 강제 해제 (기본 30분)
 *
 * [버전]
 * - 저장 시 버전이 다르면 다시 읽고 변경을 재적용 (지수 백오프, 횟수 제한)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackLeaseManager {

    private final SeatPackRepository seatPackRepository;
    private final ReconciliationProperties properties;

    /**
     * 리스 획득
     *
     * @return 획득 시 최신 팩, 다른 보유자가 있으면 empty
     */
    public Optional<SeatPack> acquire(SeatPackId packId, String holderId) {
        try {
            boolean acquired = seatPackRepository.acquireLease(packId, holderId, LocalDateTime.now());
            if (!acquired) {
                log.debug("[리스관리] 리스 획득 실패 - packId: {}, holder: {}", packId, holderId);
                return Optional.empty();
            }
            return seatPackRepository.findById(packId);
        } catch (DataAccessException e) {
            // 동시 갱신 충돌도 점유 실패로 본다
            log.warn("[리스관리] 리스 획득 중 충돌 - packId: {}, holder: {}, error: {}",
                    packId, holderId, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean release(SeatPackId packId, String holderId) {
        boolean released = seatPackRepository.releaseLease(packId, holderId);
        if (!released) {
            log.warn("[리스관리] 리스 해제 실패 - packId: {}, holder: {} (이미 해제되었거나 다른 보유자)",
                    packId, holderId);
        }
        return released;
    }

    /**
     * 리스를 잡고 작업 실행 후 해제
     *
     * @throws PackLeaseConflictException 다른 보유자가 있는 경우
     */
    public <T> T withLease(SeatPackId packId, String holderId, Function<SeatPack, T> action) {
        SeatPack pack = acquire(packId, holderId)
                .orElseThrow(() -> new PackLeaseConflictException(packId.value(), holderId));
        try {
            return action.apply(pack);
        } finally {
            release(packId, holderId);
        }
    }

    /**
     * 최신 상태를 읽어 변경을 적용하고 저장. 버전 충돌 시 재시도.
     */
    public SeatPack updateWithRetry(SeatPackId packId, Consumer<SeatPack> mutation) {
        int maxAttempts = Math.max(1, properties.getLease().getOptimisticMaxAttempts());
        long baseDelay = properties.getLease().getOptimisticBaseDelayMs();

        for (int attempt = 1; ; attempt++) {
            SeatPack pack = seatPackRepository.findById(packId)
                    .orElseThrow(() -> new SeatPackNotFoundException(packId.value()));
            mutation.accept(pack);
            try {
                return seatPackRepository.save(pack);
            } catch (OptimisticLockException | ObjectOptimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("[리스관리] 버전 충돌 재시도 초과 - packId: {}, attempts: {}", packId, attempt);
                    throw new PackVersionConflictException(packId.value(), attempt, e);
                }
                long delay = baseDelay * (1L << (attempt - 1));
                log.warn("[리스관리] 버전 충돌, 재시도 {}/{} - packId: {}, {}ms 후", attempt, maxAttempts, packId, delay);
                sleep(delay);
            }
        }
    }

    /**
     * 오래된 리스 강제 해제
     */
    public int sweepStaleLeases() {
        LocalDateTime threshold = LocalDateTime.now().minusMinutes(properties.getLease().getStaleAfterMinutes());
        int cleared = seatPackRepository.clearStaleLeases(threshold);
        if (cleared > 0) {
            log.warn("[리스관리] 오래된 리스 해제 - count: {}, threshold: {}", cleared, threshold);
        }
        return cleared;
    }

    /**
     * 진행 중 상태로 멈춘 POS 작업을 실패로 정리 (작업 중 종료된 프로세스)
     */
    public int sweepStaleOperations() {
        LocalDateTime threshold = LocalDateTime.now().minusMinutes(properties.getSync().getStaleOperationMinutes());
        int failed = seatPackRepository.failStaleOperations(threshold);
        if (failed > 0) {
            log.warn("[리스관리] 중단된 POS 작업 정리 - count: {}, threshold: {}", failed, threshold);
        }
        return failed;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("버전 충돌 재시도 대기 중 인터럽트 발생", e);
        }
    }
}

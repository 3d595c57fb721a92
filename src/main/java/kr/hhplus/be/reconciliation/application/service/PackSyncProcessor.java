package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.out.PosApiPort;
import kr.hhplus.be.reconciliation.application.port.out.PosCreateResult;
import kr.hhplus.be.reconciliation.application.port.out.PosDeleteResult;
import kr.hhplus.be.reconciliation.application.sync.CompensatingAction;
import kr.hhplus.be.reconciliation.application.sync.PackSyncOutcome;
import kr.hhplus.be.reconciliation.application.sync.PosPackValidator;
import kr.hhplus.be.reconciliation.application.sync.PosPayloadFactory;
import kr.hhplus.be.reconciliation.application.sync.RollbackStack;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 팩 하나의 POS 반영 처리
 *
 * 1. 리스 획득 (실패 시 다른 작업이 처리 중이므로 건너뜀)
 * 2. 상태에 따라 리스팅 생성 / 삭제 / 처리 없음 분기
 * 3. 리스팅 생성 후 로컬 반영이 실패하면 생성한 리스팅을 삭제 (보상)
 * 4. 리스 해제
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackSyncProcessor {

    static final String DELETE_LISTING_ACTION = "delete_pos_listing";

    private final PackLeaseManager leaseManager;
    private final PosApiPort posApiPort;
    private final PosPackValidator validator;
    private final PosPayloadFactory payloadFactory;
    private final FailedRollbackRepository failedRollbackRepository;
    private final ReconciliationProperties properties;

    public PackSyncOutcome process(SeatPackId packId, String operationId, Map<String, Performance> performances) {
        String holderId = holderId(operationId);
        Optional<SeatPack> leased = leaseManager.acquire(packId, holderId);
        if (leased.isEmpty()) {
            log.info("[POS동기화] 다른 작업이 처리 중인 팩 건너뜀 - packId: {}", packId);
            return PackSyncOutcome.LEASE_CONFLICT;
        }

        try {
            SeatPack pack = leased.get();
            if (pack.needsPush()) {
                return push(pack, operationId, performances.get(pack.getPerformanceId()));
            }
            if (pack.needsDelist()) {
                return delist(pack, operationId);
            }
            leaseManager.updateWithRetry(packId, SeatPack::markNothingToSync);
            return PackSyncOutcome.NOTHING_TO_DO;
        } finally {
            leaseManager.release(packId, holderId);
        }
    }

    private PackSyncOutcome push(SeatPack pack, String operationId, Performance performance) {
        SeatPackId packId = pack.getId();

        if (performance != null && !performance.isPosEnabled()) {
            log.info("[POS동기화] POS 비활성 공연의 팩 건너뜀 - packId: {}, performanceId: {}",
                    packId, pack.getPerformanceId());
            return PackSyncOutcome.SKIPPED;
        }

        List<String> reasons = validator.validate(pack, performance);
        if (!reasons.isEmpty()) {
            String error = "Validation failed: " + String.join(", ", reasons);
            log.warn("[POS동기화] 검증 실패 - packId: {}, reasons: {}", packId, reasons);
            recordFailure(packId, error);
            return PackSyncOutcome.VALIDATION_FAILED;
        }

        LocalDateTime now = LocalDateTime.now();
        leaseManager.updateWithRetry(packId, p -> p.startPosOperation(operationId, now));

        PosCreateResult created = posApiPort.createListing(payloadFactory.build(pack, performance, now));
        if (!created.success()) {
            log.warn("[POS동기화] 리스팅 생성 실패 - packId: {}, status: {}, error: {}",
                    packId, created.httpStatus(), created.errorMessage());
            recordFailure(packId, "POS create failed: " + created.errorMessage());
            return PackSyncOutcome.FAILED;
        }

        String listingId = created.listingId();
        RollbackStack rollback = new RollbackStack(operationId, packId.value(), failedRollbackRepository);
        rollback.push(new CompensatingAction(DELETE_LISTING_ACTION, "listingId=" + listingId, () -> {
            PosDeleteResult result = posApiPort.deleteListing(listingId);
            if (!result.isSuccess()) {
                throw new IllegalStateException("리스팅 삭제 실패 - status: "
                        + result.httpStatus() + ", error: " + result.errorMessage());
            }
        }));

        try {
            leaseManager.updateWithRetry(packId, p -> p.markPushed(listingId, LocalDateTime.now()));
            log.info("[POS동기화] 리스팅 생성 완료 - packId: {}, listingId: {}", packId, listingId);
            return PackSyncOutcome.PUSHED;
        } catch (RuntimeException e) {
            log.error("[POS동기화] 리스팅 생성 후 로컬 반영 실패, 롤백 시작 - packId: {}, listingId: {}",
                    packId, listingId, e);
            RollbackStack.UnwindReport report = rollback.unwind();
            log.warn("[POS동기화] 롤백 결과 - packId: {}, 완료: {}, 실패: {}",
                    packId, report.executed(), report.failed());
            recordFailure(packId, "Local update failed after POS create: " + e.getMessage());
            return PackSyncOutcome.FAILED;
        }
    }

    private PackSyncOutcome delist(SeatPack pack, String operationId) {
        SeatPackId packId = pack.getId();

        // POS 에 올라간 적이 없으면 로컬 상태만 정리
        if (!pack.isListed()) {
            leaseManager.updateWithRetry(packId, p -> p.markDelisted(LocalDateTime.now()));
            log.info("[POS동기화] 리스팅 없는 팩 내림 완료 - packId: {}", packId);
            return PackSyncOutcome.DELISTED;
        }

        String listingId = pack.getPosListingId();
        leaseManager.updateWithRetry(packId, p -> p.startPosOperation(operationId, LocalDateTime.now()));

        PosDeleteResult result = posApiPort.deleteListing(listingId);
        if (!result.isSuccess()) {
            log.warn("[POS동기화] 리스팅 삭제 실패 - packId: {}, listingId: {}, status: {}, error: {}",
                    packId, listingId, result.httpStatus(), result.errorMessage());
            recordFailure(packId, "POS delete failed: " + result.errorMessage());
            return PackSyncOutcome.FAILED;
        }

        if (result.outcome() == PosDeleteResult.Outcome.NOT_FOUND) {
            log.info("[POS동기화] 이미 POS 에 없는 리스팅 - packId: {}, listingId: {}", packId, listingId);
        }
        leaseManager.updateWithRetry(packId, p -> p.markDelisted(LocalDateTime.now()));
        log.info("[POS동기화] 리스팅 삭제 완료 - packId: {}, listingId: {}", packId, listingId);
        return PackSyncOutcome.DELISTED;
    }

    private void recordFailure(SeatPackId packId, String error) {
        int maxAttempts = properties.getSync().getMaxAttempts();
        try {
            SeatPack saved = leaseManager.updateWithRetry(packId, p -> p.markSyncFailed(error, LocalDateTime.now()));
            if (saved.isRetryExhausted(maxAttempts)) {
                log.warn("[POS동기화] 재시도 한도 초과, 수동 처리 필요 - packId: {}, attempts: {}",
                        packId, saved.getPosSyncAttempts());
            }
        } catch (RuntimeException e) {
            log.error("[POS동기화] 실패 상태 저장 실패 - packId: {}, error: {}", packId, error, e);
        }
    }

    private static String holderId(String operationId) {
        return "pos_sync_" + operationId.substring(0, Math.min(8, operationId.length()));
    }
}

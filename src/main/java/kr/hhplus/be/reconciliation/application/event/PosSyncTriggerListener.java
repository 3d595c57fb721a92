package kr.hhplus.be.reconciliation.application.event;

import kr.hhplus.be.reconciliation.application.port.in.PosSyncUseCase;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class PosSyncTriggerListener {

    private final PosSyncUseCase posSyncUseCase;
    private final ReconciliationProperties properties;

    /**
     * 반영 완료 후 해당 공연의 대기 팩을 바로 POS 에 반영
     * 실패해도 다음 스케줄 주기에 다시 처리되므로 로그만 남긴다.
     */
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void syncAfterReconcile(PacksReconciledEvent event) {
        if (!properties.getSync().isAutoSyncAfterReconcile() || !event.hasPosWork()) {
            return;
        }
        try {
            log.info("[POS동기화] 반영 후 자동 동기화 시작 - performanceId: {}", event.performanceId());
            PosSyncUseCase.PosSyncResult result = posSyncUseCase.syncPendingPacks(event.performanceId());
            log.info("[POS동기화] 반영 후 자동 동기화 완료 - performanceId: {}, 성공: {}, 실패: {}",
                    event.performanceId(), result.synced(), result.failed());
        } catch (Exception e) {
            log.error("[POS동기화] 반영 후 자동 동기화 실패 - performanceId: {}, error: {}",
                    event.performanceId(), e.getMessage(), e);
        }
    }
}

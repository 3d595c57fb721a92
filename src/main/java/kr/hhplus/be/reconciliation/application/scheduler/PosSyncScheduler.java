package kr.hhplus.be.reconciliation.application.scheduler;

import kr.hhplus.be.reconciliation.application.port.in.PosSyncUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 전체 공연 동기화 대기열 주기 처리 (실패 팩 재시도 포함)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduler.pos-sync.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PosSyncScheduler {

    private final PosSyncUseCase posSyncUseCase;

    @Scheduled(fixedDelayString = "${app.scheduler.pos-sync.fixed-delay-ms:60000}")
    public void syncPendingPacks() {
        try {
            PosSyncUseCase.PosSyncResult result = posSyncUseCase.syncPendingPacks(null);
            if (result.totalPacks() > 0) {
                log.info("[POS동기화스케줄] 대상: {}, 성공: {}, 실패: {}, 건너뜀: {}",
                        result.totalPacks(), result.synced(), result.failed(), result.skipped());
            }
        } catch (Exception e) {
            log.error("[POS동기화스케줄] 처리 중 오류 발생", e);
        }
    }
}

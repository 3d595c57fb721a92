package kr.hhplus.be.reconciliation.application.scheduler;

import kr.hhplus.be.reconciliation.application.service.PackLeaseManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduler.lease-maintenance.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class LeaseMaintenanceScheduler {

    private final PackLeaseManager leaseManager;

    /**
     * 오래된 리스 해제 - 기본 5분마다
     */
    @Scheduled(fixedDelayString = "${app.scheduler.lease-maintenance.fixed-delay-ms:300000}")
    public void clearStaleLeases() {
        try {
            leaseManager.sweepStaleLeases();
        } catch (Exception e) {
            log.error("[리스정리] 처리 중 오류 발생", e);
        }
    }

    /**
     * 진행 중으로 멈춘 POS 작업 실패 처리 - 기본 10분마다
     */
    @Scheduled(fixedDelayString = "${app.scheduler.lease-maintenance.operation-delay-ms:600000}")
    public void failStaleOperations() {
        try {
            leaseManager.sweepStaleOperations();
        } catch (Exception e) {
            log.error("[POS작업정리] 처리 중 오류 발생", e);
        }
    }
}

package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.in.PosSyncUseCase;
import kr.hhplus.be.reconciliation.application.port.out.SyncNotification;
import kr.hhplus.be.reconciliation.application.port.out.SyncNotificationPort;
import kr.hhplus.be.reconciliation.application.sync.PackSyncOutcome;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * POS 동기화 엔진
 *
 * 대기열의 팩을 배치 단위로 처리한다. 팩 하나의 실패는 다른 팩 처리에 영향을 주지 않으며,
 * 엔진은 예외를 던지지 않고 항상 요약 결과를 반환한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PosSyncEngine implements PosSyncUseCase {

    private static final int MAX_REPORTED_ERRORS = 20;

    private final SeatPackRepository seatPackRepository;
    private final PerformanceRepository performanceRepository;
    private final PackSyncProcessor packSyncProcessor;
    private final SyncNotificationPort notificationPort;
    private final ReconciliationProperties properties;

    @Override
    public PosSyncResult syncPendingPacks(String performanceId) {
        String operationId = UUID.randomUUID().toString();
        long startedAt = System.currentTimeMillis();
        Counter counter = new Counter();
        int total = 0;

        try {
            List<SeatPack> queue = seatPackRepository.findSyncQueue(
                    performanceId, properties.getSync().getMaxAttempts(), Integer.MAX_VALUE);
            total = queue.size();
            if (queue.isEmpty()) {
                log.debug("[POS동기화] 처리할 팩 없음 - performanceId: {}", performanceId);
                return result(true, operationId, performanceId, 0, counter, startedAt);
            }

            Map<String, Performance> performances = loadPerformances(queue);
            Performance single = performanceId == null ? null : performances.get(performanceId);
            notifySafely(SyncNotification.started(operationId, performanceId,
                    single == null ? null : single.getVenueName(),
                    single == null ? null : single.getEventName(), total));

            log.info("[POS동기화] 시작 - operationId: {}, performanceId: {}, 대상: {}",
                    operationId, performanceId, total);

            int batchSize = Math.max(1, properties.getSync().getBatchSize());
            for (int from = 0; from < queue.size(); from += batchSize) {
                if (from > 0) {
                    pause(properties.getSync().getBatchDelayMs());
                }
                List<SeatPack> batch = queue.subList(from, Math.min(from + batchSize, queue.size()));
                for (SeatPack pack : batch) {
                    try {
                        counter.add(packSyncProcessor.process(pack.getId(), operationId, performances));
                    } catch (Exception e) {
                        log.error("[POS동기화] 팩 처리 중 오류 - packId: {}", pack.getId(), e);
                        counter.fail(pack.getId().value() + ": " + e.getMessage());
                    }
                }
                log.debug("[POS동기화] 배치 완료 - operationId: {}, 진행: {}/{}",
                        operationId, Math.min(from + batchSize, total), total);
            }

            PosSyncResult result = result(true, operationId, performanceId, total, counter, startedAt);
            notifySafely(new SyncNotification(SyncNotification.Type.COMPLETED, operationId, performanceId,
                    single == null ? null : single.getVenueName(),
                    single == null ? null : single.getEventName(),
                    total, result.synced(), result.failed(), result.skipped(),
                    result.executionSeconds(), result.errors()));

            log.info("[POS동기화] 완료 - operationId: {}, 성공: {}, 실패: {}, 건너뜀: {}, {}초",
                    operationId, result.synced(), result.failed(), result.skipped(), result.executionSeconds());
            return result;

        } catch (Exception e) {
            log.error("[POS동기화] 동기화 실패 - operationId: {}, performanceId: {}", operationId, performanceId, e);
            counter.error(e.getMessage());
            PosSyncResult result = result(false, operationId, performanceId, total, counter, startedAt);
            notifySafely(new SyncNotification(SyncNotification.Type.FAILED, operationId, performanceId,
                    null, null, total, result.synced(), result.failed(), result.skipped(),
                    result.executionSeconds(), result.errors()));
            return result;
        }
    }

    private Map<String, Performance> loadPerformances(List<SeatPack> queue) {
        Set<String> ids = queue.stream().map(SeatPack::getPerformanceId).collect(Collectors.toSet());
        return performanceRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Performance::getPerformanceId, Function.identity()));
    }

    // 알림 실패는 동기화 결과에 영향을 주지 않는다
    private void notifySafely(SyncNotification notification) {
        try {
            notificationPort.notify(notification);
        } catch (Exception e) {
            log.warn("[POS동기화] 알림 전송 실패 - operationId: {}, type: {}, error: {}",
                    notification.operationId(), notification.type(), e.getMessage());
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("배치 간 대기 중 인터럽트 발생", e);
        }
    }

    private PosSyncResult result(boolean success, String operationId, String performanceId,
                                 int total, Counter counter, long startedAt) {
        double seconds = (System.currentTimeMillis() - startedAt) / 1000.0;
        return new PosSyncResult(success, operationId, performanceId, total,
                counter.synced, counter.failed, counter.skipped, seconds, List.copyOf(counter.errors));
    }

    private static class Counter {
        private int synced;
        private int failed;
        private int skipped;
        private final List<String> errors = new ArrayList<>();

        void add(PackSyncOutcome outcome) {
            switch (outcome.getCategory()) {
                case SYNCED -> synced++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }

        void fail(String error) {
            failed++;
            error(error);
        }

        void error(String error) {
            if (errors.size() < MAX_REPORTED_ERRORS) {
                errors.add(error);
            }
        }
    }
}

package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.in.ManualPackUseCase;
import kr.hhplus.be.reconciliation.application.port.in.SeatPackView;
import kr.hhplus.be.reconciliation.application.port.out.PosApiPort;
import kr.hhplus.be.reconciliation.application.port.out.PosHoldResult;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceNotFoundException;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.InvalidPackTransitionException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.SeatPackNotFoundException;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 운영자 수동 작업
 * - 수동 내림 / 재활성화 / 관리자 홀드
 * - 재시도 한도 초과 팩 재등록
 * - 공연 단위 POS 연동 켜기/끄기
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualPackService implements ManualPackUseCase {

    private static final int RECENT_MANUAL_DELIST_DAYS = 7;

    private final SeatPackRepository seatPackRepository;
    private final PerformanceRepository performanceRepository;
    private final PackLeaseManager leaseManager;
    private final PosApiPort posApiPort;
    private final ReconciliationProperties properties;

    @Override
    public SeatPackView manualDelist(ManualDelistCommand command) {
        SeatPackId packId = SeatPackId.of(command.packId());
        SeatPack saved = leaseManager.updateWithRetry(packId,
                pack -> pack.manualDelist(command.operator(), command.reason(), LocalDateTime.now()));
        log.info("[수동작업] 수동 내림 - packId: {}, operator: {}, reason: {}",
                packId, command.operator(), command.reason());
        return SeatPackView.from(saved);
    }

    @Override
    public SeatPackView reactivate(ReactivateCommand command) {
        SeatPackId packId = SeatPackId.of(command.packId());
        SeatPack saved = leaseManager.updateWithRetry(packId,
                pack -> pack.reactivate(command.operator(), LocalDateTime.now()));
        log.info("[수동작업] 재활성화 - packId: {}, operator: {}", packId, command.operator());
        return SeatPackView.from(saved);
    }

    /**
     * POS 리스팅을 지우지 않고 판매만 중지 (만료일 지정)
     */
    @Override
    public SeatPackView adminHold(AdminHoldCommand command) {
        SeatPackId packId = SeatPackId.of(command.packId());
        SeatPack pack = loadPack(packId);
        if (!pack.isActive()) {
            throw new InvalidPackTransitionException(packId, "활성 팩만 관리자 홀드를 걸 수 있습니다");
        }

        if (pack.isListed()) {
            LocalDateTime expiresAt = LocalDateTime.now().plusDays(properties.getPos().getAdminHoldExpirationDays());
            String notes = command.notes() == null
                    ? "Admin hold by " + command.operator()
                    : command.notes();
            PosHoldResult result = posApiPort.applyAdminHold(pack.getPosListingId(), expiresAt, notes);
            if (!result.success()) {
                log.warn("[수동작업] 관리자 홀드 실패 - packId: {}, status: {}, error: {}",
                        packId, result.httpStatus(), result.errorMessage());
                throw new IllegalStateException("POS 관리자 홀드 적용 실패: " + result.errorMessage());
            }
        }

        SeatPack saved = leaseManager.updateWithRetry(packId, p -> p.markAdminHeld(LocalDateTime.now()));
        log.info("[수동작업] 관리자 홀드 - packId: {}, operator: {}, listingId: {}",
                packId, command.operator(), saved.getPosListingId());
        return SeatPackView.from(saved);
    }

    @Override
    public SeatPackView requeue(String packId, String operator) {
        SeatPack saved = leaseManager.updateWithRetry(SeatPackId.of(packId), SeatPack::requeue);
        log.info("[수동작업] 동기화 재등록 - packId: {}, operator: {}", packId, operator);
        return SeatPackView.from(saved);
    }

    /**
     * 끄면 공연의 활성 팩을 모두 내리고, 켜면 밀려 있던 팩을 다시 대기열에 넣는다
     */
    @Override
    @Transactional
    public PerformanceToggleResult setPerformancePosEnabled(String performanceId, boolean enabled, String operator) {
        Performance performance = performanceRepository.findById(performanceId)
                .orElseThrow(() -> new PerformanceNotFoundException(performanceId));

        if (enabled) {
            performance.enablePos();
        } else {
            performance.disablePos();
        }
        performanceRepository.save(performance);

        int affected = 0;
        for (SeatPack pack : seatPackRepository.findActiveByPerformanceId(performanceId)) {
            if (!enabled) {
                leaseManager.updateWithRetry(pack.getId(), p -> p.delist(DelistReason.PERFORMANCE_DISABLED));
                affected++;
            } else if (!pack.isSyncedToPos()) {
                leaseManager.updateWithRetry(pack.getId(), SeatPack::queueForSync);
                affected++;
            }
        }

        log.info("[수동작업] 공연 POS 연동 {} - performanceId: {}, operator: {}, 영향 팩: {}",
                enabled ? "켜기" : "끄기", performanceId, operator, affected);
        return new PerformanceToggleResult(performanceId, enabled, affected);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatPackView> findDelistable(String performanceId) {
        return seatPackRepository.findManuallyDelistable(performanceId).stream()
                .map(SeatPackView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatPackView> findReactivatable(String performanceId) {
        return seatPackRepository.findManuallyReactivatable(performanceId).stream()
                .map(SeatPackView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatPackView> findRecentManualDelists() {
        return seatPackRepository.findRecentManualDelists(LocalDateTime.now().minusDays(RECENT_MANUAL_DELIST_DAYS))
                .stream()
                .map(SeatPackView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatPackView> findRetryExhausted() {
        return seatPackRepository.findRetryExhausted(properties.getSync().getMaxAttempts()).stream()
                .map(SeatPackView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatPackView> findChildren(String parentPackId) {
        SeatPackId parentId = SeatPackId.of(parentPackId);
        loadPack(parentId);
        return seatPackRepository.findChildren(parentId).stream()
                .map(SeatPackView::from)
                .toList();
    }

    private SeatPack loadPack(SeatPackId packId) {
        return seatPackRepository.findById(packId)
                .orElseThrow(() -> new SeatPackNotFoundException(packId.value()));
    }
}

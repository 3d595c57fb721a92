package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.in.VenueStructureUseCase;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceRepository;
import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackLeaseConflictException;
import kr.hhplus.be.reconciliation.domain.venue.VenueSeatStructure;
import kr.hhplus.be.reconciliation.domain.venue.VenueSeatStructureRepository;
import kr.hhplus.be.reconciliation.domain.venue.VenueStructureChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 공연장 좌석 번호 체계 변경 감지
 *
 * 번호 체계가 바뀌면 기존 팩의 인접 판단이 모두 틀어지므로 공연장 전체의 활성 팩을 내린다.
 * 내림은 팩 리스를 잡고 처리하며, POS 동기화가 점유 중인 팩은 건너뛰고 결과에 남긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VenueStructureChangeService implements VenueStructureUseCase {

    private final VenueSeatStructureRepository structureRepository;
    private final PerformanceRepository performanceRepository;
    private final SeatPackRepository seatPackRepository;
    private final PackLeaseManager leaseManager;

    @Override
    @Transactional
    public StructureChangeResult applyDetectedScheme(String venueId, NumberingScheme detected) {
        LocalDateTime now = LocalDateTime.now();

        Optional<VenueSeatStructure> recorded = structureRepository.findByVenueId(venueId);
        if (recorded.isEmpty()) {
            structureRepository.save(VenueSeatStructure.first(venueId, detected, now));
            log.info("[번호체계] 최초 기록 - venueId: {}, scheme: {}", venueId, detected.getCode());
            return StructureChangeResult.unchanged(venueId, detected);
        }

        VenueSeatStructure structure = recorded.get();
        Optional<VenueStructureChange> change = structure.record(detected, now);
        structureRepository.save(structure);
        if (change.isEmpty()) {
            return StructureChangeResult.unchanged(venueId, detected);
        }

        VenueStructureChange detectedChange = change.get();
        log.warn("[번호체계] 변경 감지 - venueId: {}, {} → {}",
                venueId, detectedChange.previousScheme().getCode(), detectedChange.currentScheme().getCode());

        List<String> performanceIds = performanceRepository.findByVenueId(venueId).stream()
                .map(Performance::getPerformanceId)
                .toList();
        String holderId = "structure_" + UUID.randomUUID().toString().substring(0, 8);
        int delisted = 0;
        List<String> deferred = new ArrayList<>();
        for (SeatPack pack : seatPackRepository.findActiveByPerformanceIds(performanceIds)) {
            if (pack.isOperatorHeld()) {
                continue;
            }
            try {
                leaseManager.withLease(pack.getId(), holderId, leased ->
                        leaseManager.updateWithRetry(pack.getId(), p -> p.delist(DelistReason.STRUCTURE_CHANGE)));
                delisted++;
            } catch (PackLeaseConflictException e) {
                log.warn("[번호체계] 점유 중인 팩은 내리지 않음 - packId: {}", pack.getId());
                deferred.add(pack.getId().value());
            }
        }

        log.warn("[번호체계] 공연장 팩 내림 완료 - venueId: {}, 공연: {}, 팩: {}, 보류: {}",
                venueId, performanceIds.size(), delisted, deferred.size());
        return new StructureChangeResult(venueId, true, detectedChange.previousScheme(),
                detectedChange.currentScheme(), performanceIds, delisted, deferred);
    }
}

package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.event.PacksReconciledEvent;
import kr.hhplus.be.reconciliation.application.port.in.ReconciliationUseCase;
import kr.hhplus.be.reconciliation.application.port.in.VenueStructureUseCase;
import kr.hhplus.be.reconciliation.application.port.in.VenueStructureUseCase.StructureChangeResult;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceNotFoundException;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceRepository;
import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;
import kr.hhplus.be.reconciliation.domain.seat.SeatSnapshot;
import kr.hhplus.be.reconciliation.domain.seat.SeatSnapshotRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.service.GenerationRequest;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackingStrategy;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SeatPackComparator;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SeatPackGenerator;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlan;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlanner;
import kr.hhplus.be.reconciliation.domain.seatpack.service.WorkflowScenario;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import kr.hhplus.be.reconciliation.infrastructure.redis.lock.LockAcquisitionException;
import kr.hhplus.be.reconciliation.infrastructure.redis.lock.RedisDistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 스크랩 결과 반영 워크플로
 *
 * [동시성 제어]
 * - 공연 단위 Redis 분산락: 같은 공연의 반영 작업은 동시에 하나만
 * - 팩 단위 리스: 이번 주기에 바꿀 팩의 리스를 먼저 잡고, 잡지 못한 팩과 그 변환 묶음은 다음 스크랩으로 미룬다
 * - 팩 저장은 버전 검사 + 재시도
 *
 * [흐름]
 * 1. 공연 정보 등록/갱신
 * 2. 공연장 번호 체계 판별 및 변경 감지
 * 3. 스크랩 입력 보관, 팩 생성 → 기존 활성 팩과 비교 → 내림 → 가격 변경 → 신규/재생성 순으로 저장
 * 4. 번호 체계가 바뀌었으면 같은 공연장의 다른 공연도 보관된 좌석으로 다시 생성
 * 5. 커밋 후 POS 동기화 이벤트 발행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService implements ReconciliationUseCase {

    private final PerformanceRepository performanceRepository;
    private final SeatPackRepository seatPackRepository;
    private final SeatSnapshotRepository seatSnapshotRepository;
    private final SeatPackGenerator generator;
    private final SeatPackComparator comparator;
    private final SyncPlanner planner;
    private final PackLeaseManager leaseManager;
    private final VenueStructureUseCase venueStructureUseCase;
    private final SourcePrefixRegistry prefixRegistry;
    private final RedisDistributedLock distributedLock;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final ReconciliationProperties properties;

    @Override
    public WorkflowResult reconcile(ReconcileCommand command) {
        long startedAt = System.currentTimeMillis();
        String performanceId = command.performanceId();
        ReconciliationProperties.CycleLock lock = properties.getCycleLock();

        try {
            return distributedLock.executeWithLock(
                    RedisDistributedLock.buildPerformanceLockKey(performanceId),
                    lock.getTtlSeconds(),
                    lock.getRetryCount(),
                    lock.getRetryDelayMs(),
                    () -> transactionTemplate.execute(status -> doReconcile(command, startedAt))
            );
        } catch (LockAcquisitionException e) {
            log.warn("[반영] 같은 공연의 반영 작업이 진행 중 - performanceId: {}", performanceId);
            return WorkflowResult.failed(performanceId, elapsed(startedAt), e.getMessage());
        } catch (PerformanceNotFoundException | IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            log.error("[반영] 반영 실패 - performanceId: {}", performanceId, e);
            return WorkflowResult.failed(performanceId, elapsed(startedAt), e.getMessage());
        }
    }

    private WorkflowResult doReconcile(ReconcileCommand command, long startedAt) {
        String performanceId = command.performanceId();
        String holderId = "reconcile_" + UUID.randomUUID().toString().substring(0, 8);
        List<String> warnings = new ArrayList<>();

        // 1. 공연 정보
        Performance performance = upsertPerformance(command);

        // 2. 번호 체계
        NumberingScheme venueScheme = command.numberingScheme() == null
                ? generator.detectVenueScheme(command.seats())
                : NumberingScheme.fromCode(command.numberingScheme());
        StructureChangeResult structure =
                venueStructureUseCase.applyDetectedScheme(performance.getVenueId(), venueScheme);
        if (structure.changed()) {
            warnings.add(String.format("공연장 번호 체계 변경: %s → %s, 내린 팩 %d개",
                    structure.previousScheme(), structure.currentScheme(), structure.delistedPacks()));
            structure.deferredPackIds().forEach(id -> warnings.add("점유 중인 팩 구조 변경 내림 보류: " + id));
        }

        // 3. 입력 보관 → 생성 → 비교 → 저장
        SeatSnapshot snapshot = seatSnapshotRepository.save(toSnapshot(command));
        PackCycle cycle = applyCycle(toGenerationRequest(snapshot, venueScheme), holderId, warnings);

        // 4. 같은 공연장의 다른 공연은 보관된 좌석으로 새 체계에 맞춰 다시 생성
        if (structure.changed()) {
            regenerateVenuePerformances(structure, performanceId, holderId, warnings);
        }

        // 5. 커밋 후 동기화
        eventPublisher.publishEvent(new PacksReconciledEvent(performanceId, cycle.created(), cycle.delisted(),
                cycle.resynced(), LocalDateTime.now()));

        WorkflowResult result = new WorkflowResult(true, performanceId, cycle.scenario(), cycle.processed(),
                cycle.created(), cycle.updated(), cycle.delisted(), cycle.resynced(), structure.changed(),
                elapsed(startedAt), List.of(), List.copyOf(warnings));

        log.info("[반영] 완료 - performanceId: {}, 생성: {}, 가격변경: {}, 내림: {}, 재동기화: {}, 경고: {}",
                performanceId, cycle.created(), cycle.updated(), cycle.delisted(), cycle.resynced(), warnings.size());
        return result;
    }

    private Performance upsertPerformance(ReconcileCommand command) {
        PerformanceInfo info = command.performance();
        if (info == null) {
            return performanceRepository.findById(command.performanceId())
                    .orElseThrow(() -> new PerformanceNotFoundException(command.performanceId()));
        }
        Performance performance = performanceRepository.findById(command.performanceId())
                .map(existing -> {
                    existing.updateInfo(info.eventName(), info.eventDate(), info.venueName(),
                            info.city(), info.stateProvince(), info.countryCode());
                    return existing;
                })
                .orElseGet(() -> Performance.create(command.performanceId(), info.venueId(), info.eventName(),
                        info.eventDate(), info.venueName(), info.city(), info.stateProvince(),
                        info.countryCode()));
        return performanceRepository.save(performance);
    }

    private SeatSnapshot toSnapshot(ReconcileCommand command) {
        return new SeatSnapshot(command.performanceId(), command.source(), command.seats(),
                command.sectionSchemes(), command.minPackSize(), command.packingStrategy(), command.markup(),
                LocalDateTime.now());
    }

    private GenerationRequest toGenerationRequest(SeatSnapshot snapshot, NumberingScheme venueScheme) {
        ReconciliationProperties.Generation generation = properties.getGeneration();

        Map<String, NumberingScheme> sectionSchemes = new LinkedHashMap<>();
        snapshot.sectionSchemes().forEach((section, code) ->
                sectionSchemes.put(section, NumberingScheme.fromCode(code)));

        int minPackSize = snapshot.minPackSize() == null ? generation.getMinPackSize() : snapshot.minPackSize();
        PackingStrategy strategy = PackingStrategy.fromCode(
                snapshot.packingStrategy() == null ? generation.getStrategy() : snapshot.packingStrategy());

        return new GenerationRequest(snapshot.performanceId(), snapshot.source(),
                prefixRegistry.prefixOf(snapshot.source()), snapshot.seats(), venueScheme, sectionSchemes,
                minPackSize, strategy, snapshot.markup());
    }

    /**
     * 한 공연의 팩 생성 → 비교 → 저장
     */
    private PackCycle applyCycle(GenerationRequest request, String holderId, List<String> warnings) {
        String performanceId = request.performanceId();
        List<SeatPack> activePacks = seatPackRepository.findActiveByPerformanceId(performanceId);
        WorkflowScenario scenario = WorkflowScenario.determine(activePacks.size());

        List<CandidatePack> candidates = generator.generate(request);
        PackComparison comparison = comparator.compare(performanceId, candidates, activePacks);
        SyncPlan plan = planner.plan(comparison, scenario);

        log.info("[반영] 시작 - performanceId: {}, 시나리오: {}, {}",
                performanceId, scenario.getDisplayName(), comparison.summary());

        Map<SeatPackId, SeatPack> previous = seatPackRepository.findAllById(
                        plan.creations().stream().map(action -> action.pack().id()).toList())
                .stream()
                .collect(Collectors.toMap(SeatPack::getId, Function.identity()));

        Set<SeatPackId> targets = new LinkedHashSet<>();
        plan.delists().forEach(action -> targets.add(action.packId()));
        plan.priceUpdates().forEach(action -> targets.add(action.packId()));
        previous.values().stream()
                .filter(pack -> !pack.isOperatorHeld())
                .forEach(pack -> targets.add(pack.getId()));

        Set<SeatPackId> held = new LinkedHashSet<>();
        try {
            Set<SeatPackId> blocked = new LinkedHashSet<>();
            for (SeatPackId target : targets) {
                if (leaseManager.acquire(target, holderId).isPresent()) {
                    held.add(target);
                } else {
                    blocked.add(target);
                }
            }
            Set<SeatPackId> deferred = deferTransformationGroups(blocked, plan.creations());

            int delisted = applyDelists(plan.delists(), blocked, deferred, warnings);
            int updated = applyPriceUpdates(plan.priceUpdates(), blocked, warnings);
            int created = applyCreations(plan.creations(), previous, deferred, warnings);
            return new PackCycle(scenario, candidates.size(), created, updated, delisted, plan.resyncs().size());
        } finally {
            held.forEach(id -> leaseManager.release(id, holderId));
        }
    }

    /**
     * 점유 중인 팩이 걸린 변환 묶음을 통째로 미룬다.
     * 원본 팩이 남아 있는 동안 그 좌석으로 만든 새 팩이 따로 올라가면 같은 좌석이 두 번 판매된다.
     * 새 팩 하나가 미뤄지면 그 팩의 다른 원본 팩들도 함께 남겨 계보가 끊기지 않게 한다.
     */
    private static Set<SeatPackId> deferTransformationGroups(Set<SeatPackId> blocked,
                                                             List<SyncPlan.CreationAction> creations) {
        Set<SeatPackId> deferred = new LinkedHashSet<>(blocked);
        boolean grown = true;
        while (grown) {
            grown = false;
            for (SyncPlan.CreationAction action : creations) {
                boolean touched = deferred.contains(action.pack().id())
                        || action.sourcePackIds().stream().anyMatch(deferred::contains);
                if (touched) {
                    grown |= deferred.add(action.pack().id());
                    grown |= deferred.addAll(action.sourcePackIds());
                }
            }
        }
        return deferred;
    }

    private int applyDelists(List<SyncPlan.DelistAction> delists, Set<SeatPackId> blocked,
                             Set<SeatPackId> deferred, List<String> warnings) {
        int count = 0;
        for (SyncPlan.DelistAction action : delists) {
            if (blocked.contains(action.packId())) {
                log.warn("[반영] 다른 작업이 점유 중인 팩은 다음 주기에 내림 - packId: {}", action.packId());
                warnings.add("점유 중인 팩 내림 보류: " + action.packId());
                continue;
            }
            if (deferred.contains(action.packId())) {
                log.warn("[반영] 같은 변환 묶음의 팩이 점유 중이라 내림 보류 - packId: {}", action.packId());
                warnings.add("연관 팩 점유로 내림 보류: " + action.packId());
                continue;
            }
            leaseManager.updateWithRetry(action.packId(), pack -> {
                if (action.reason() == DelistReason.TRANSFORMED) {
                    pack.transform();
                } else {
                    pack.delist(action.reason());
                }
            });
            count++;
        }
        return count;
    }

    private int applyPriceUpdates(List<SyncPlan.PriceUpdateAction> updates, Set<SeatPackId> blocked,
                                  List<String> warnings) {
        int count = 0;
        for (SyncPlan.PriceUpdateAction action : updates) {
            if (blocked.contains(action.packId())) {
                log.warn("[반영] 다른 작업이 점유 중인 팩은 다음 주기에 가격 변경 - packId: {}", action.packId());
                warnings.add("점유 중인 팩 가격 변경 보류: " + action.packId());
                continue;
            }
            leaseManager.updateWithRetry(action.packId(),
                    pack -> pack.updatePrice(action.newSeatPrice(), action.newTotalPrice()));
            count++;
        }
        return count;
    }

    private int applyCreations(List<SyncPlan.CreationAction> creations, Map<SeatPackId, SeatPack> previousById,
                               Set<SeatPackId> deferred, List<String> warnings) {
        LocalDateTime now = LocalDateTime.now();
        int count = 0;
        for (SyncPlan.CreationAction action : creations) {
            SeatPackId packId = action.pack().id();
            if (deferred.contains(packId)) {
                log.warn("[반영] 원본 팩 또는 기존 기록이 점유 중이라 생성 보류 - packId: {}, sources: {}",
                        packId, action.sourcePackIds());
                warnings.add("점유 중인 팩과 얽혀 생성 보류: " + packId);
                continue;
            }
            List<String> sourceIds = action.sourcePackIds().stream().map(SeatPackId::value).toList();
            SeatPack previous = previousById.get(packId);

            if (previous == null) {
                seatPackRepository.save(SeatPack.create(action.pack(), action.origin(), sourceIds, now));
                count++;
                continue;
            }
            // 같은 좌석 구성이 다시 나타남
            if (previous.isOperatorHeld()) {
                log.warn("[반영] 운영자가 내린 팩은 다시 열지 않음 - packId: {}, reason: {}",
                        previous.getId(), previous.getDelistReason());
                warnings.add("운영자 보류 팩 재생성 생략: " + previous.getId());
                continue;
            }
            leaseManager.updateWithRetry(previous.getId(),
                    pack -> pack.reopen(action.pack(), action.origin(), sourceIds));
            count++;
        }
        return count;
    }

    private void regenerateVenuePerformances(StructureChangeResult structure, String scrapedPerformanceId,
                                             String holderId, List<String> warnings) {
        ReconciliationProperties.CycleLock lock = properties.getCycleLock();
        int regenerated = 0;
        for (String performanceId : structure.affectedPerformanceIds()) {
            if (performanceId.equals(scrapedPerformanceId)) {
                continue;
            }
            Optional<SeatSnapshot> snapshot = seatSnapshotRepository.findByPerformanceId(performanceId);
            if (snapshot.isEmpty()) {
                log.warn("[반영] 보관된 좌석이 없어 다음 스크랩 때 재생성 - performanceId: {}", performanceId);
                warnings.add("보관된 좌석 없음, 재생성 보류: " + performanceId);
                continue;
            }
            try {
                PackCycle cycle = distributedLock.executeWithLock(
                        RedisDistributedLock.buildPerformanceLockKey(performanceId),
                        lock.getTtlSeconds(), 1, 0L,
                        () -> applyCycle(toGenerationRequest(snapshot.get(), structure.currentScheme()),
                                holderId, warnings));
                eventPublisher.publishEvent(new PacksReconciledEvent(performanceId, cycle.created(),
                        cycle.delisted(), cycle.resynced(), LocalDateTime.now()));
                regenerated++;
            } catch (LockAcquisitionException e) {
                log.warn("[반영] 반영 중인 공연은 재생성 생략 - performanceId: {}", performanceId);
                warnings.add("반영 중인 공연 재생성 생략: " + performanceId);
            }
        }
        log.info("[반영] 번호 체계 변경으로 같은 공연장 공연 재생성 - venueId: {}, 공연: {}",
                structure.venueId(), regenerated);
    }

    private record PackCycle(WorkflowScenario scenario, int processed, int created, int updated,
                             int delisted, int resynced) {
    }

    private static double elapsed(long startedAt) {
        return (System.currentTimeMillis() - startedAt) / 1000.0;
    }
}

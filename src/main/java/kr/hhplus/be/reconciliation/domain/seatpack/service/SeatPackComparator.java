package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.PackStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison.ClassifiedPack;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison.PriceChange;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison.RemovalKind;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison.RemovedPack;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기존 활성 팩 ↔ 새 팩 비교기
 *
 * 1. ID 기준 조회 맵 구성
 * 2. 양쪽에 있는 ID: 가격까지 같으면 identical, 가격만 다르면 equivalent
 * 3. 기존에만 있으면 제거 후보, 새 쪽에만 있으면 생성 후보
 * 4. 생성 후보의 좌석으로 원본 팩을 찾아 create / shrink / split / merge 분류
 * 5. 원본으로 쓰인 제거 팩은 transformed, 아니면 vanished
 *
 * 좌석 겹침은 같은 구역+열 안에서만 계산한다.
 */
@Slf4j
@Component
public class SeatPackComparator {

    public PackComparison compare(String performanceId, List<CandidatePack> newPacks, List<SeatPack> existingPacks) {
        // 1. 조회 맵
        Map<SeatPackId, SeatPack> existingById = new LinkedHashMap<>();
        for (SeatPack pack : existingPacks) {
            if (pack.getPackStatus() == PackStatus.ACTIVE) {
                existingById.put(pack.getId(), pack);
            }
        }
        Map<SeatPackId, CandidatePack> newById = new LinkedHashMap<>();
        for (CandidatePack pack : newPacks) {
            newById.putIfAbsent(pack.id(), pack);
        }

        // 2. 양쪽에 모두 있는 팩
        List<SeatPack> identical = new ArrayList<>();
        List<PriceChange> equivalent = new ArrayList<>();
        newById.forEach((id, candidate) -> {
            SeatPack existing = existingById.get(id);
            if (existing == null) {
                return;
            }
            if (candidate.hasSamePrice(existing)) {
                identical.add(existing);
            } else {
                equivalent.add(new PriceChange(existing, candidate));
            }
        });

        // 3. 제거/생성 후보
        List<SeatPack> removedCandidates = existingById.values().stream()
                .filter(pack -> !newById.containsKey(pack.getId()))
                .toList();
        List<CandidatePack> createdCandidates = newById.values().stream()
                .filter(pack -> !existingById.containsKey(pack.id()))
                .toList();

        // 4. 좌석 → 원본 팩 (구역+열 버킷 단위)
        Map<String, Map<String, Set<SeatPackId>>> seatOwners = buildSeatOwners(removedCandidates);

        Map<SeatPackId, List<SeatPackId>> sourcesByChild = new LinkedHashMap<>();
        Map<SeatPackId, List<SeatPackId>> childrenBySource = new LinkedHashMap<>();
        for (CandidatePack candidate : createdCandidates) {
            Map<String, Set<SeatPackId>> owners = seatOwners.getOrDefault(candidate.location().bucketKey(), Map.of());
            Set<SeatPackId> sources = new LinkedHashSet<>();
            for (String seatId : candidate.seatIds()) {
                sources.addAll(owners.getOrDefault(seatId, Set.of()));
            }
            sourcesByChild.put(candidate.id(), List.copyOf(sources));
            for (SeatPackId source : sources) {
                childrenBySource.computeIfAbsent(source, s -> new ArrayList<>()).add(candidate.id());
            }
        }

        List<ClassifiedPack> created = new ArrayList<>();
        for (CandidatePack candidate : createdCandidates) {
            List<SeatPackId> sources = sourcesByChild.get(candidate.id());
            PackState origin = classifyOrigin(sources, childrenBySource);
            created.add(new ClassifiedPack(candidate, origin, sources));
        }

        // 5. 제거 팩 분류
        List<RemovedPack> removed = new ArrayList<>();
        for (SeatPack pack : removedCandidates) {
            List<SeatPackId> children = childrenBySource.getOrDefault(pack.getId(), List.of());
            RemovalKind kind = children.isEmpty() ? RemovalKind.VANISHED : RemovalKind.TRANSFORMED;
            removed.add(new RemovedPack(pack, kind, children));
        }

        PackComparison comparison = new PackComparison(
                performanceId, identical, equivalent, created, removed, childrenBySource);
        log.info("[팩비교] 공연: {}, 기존: {}, 신규 입력: {}, 결과: {}",
                performanceId, existingById.size(), newById.size(), comparison.summary());
        return comparison;
    }

    private Map<String, Map<String, Set<SeatPackId>>> buildSeatOwners(List<SeatPack> packs) {
        Map<String, Map<String, Set<SeatPackId>>> owners = new HashMap<>();
        for (SeatPack pack : packs) {
            Map<String, Set<SeatPackId>> bucket =
                    owners.computeIfAbsent(pack.getLocation().bucketKey(), k -> new HashMap<>());
            for (String seatId : pack.getSeatIds()) {
                bucket.computeIfAbsent(seatId, s -> new LinkedHashSet<>()).add(pack.getId());
            }
        }
        return owners;
    }

    private PackState classifyOrigin(List<SeatPackId> sources, Map<SeatPackId, List<SeatPackId>> childrenBySource) {
        if (sources.isEmpty()) {
            return PackState.CREATE;
        }
        if (sources.size() > 1) {
            return PackState.MERGE;
        }
        int siblings = childrenBySource.get(sources.get(0)).size();
        return siblings == 1 ? PackState.SHRINK : PackState.SPLIT;
    }
}

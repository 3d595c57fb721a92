package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 기존 활성 팩과 새로 생성된 팩의 비교 결과 (불변)
 *
 * 기존 팩은 identical / equivalent / removed 중 정확히 하나,
 * 새 팩은 identical / equivalent / created 중 정확히 하나에 속한다.
 */
public record PackComparison(
        String performanceId,
        List<SeatPack> identical,
        List<PriceChange> equivalent,
        List<ClassifiedPack> created,
        List<RemovedPack> removed,
        Map<SeatPackId, List<SeatPackId>> lineage
) {

    public PackComparison {
        identical = List.copyOf(identical);
        equivalent = List.copyOf(equivalent);
        created = List.copyOf(created);
        removed = List.copyOf(removed);
        lineage = lineage.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    /**
     * 새로 생긴 팩과 그 출처
     */
    public record ClassifiedPack(CandidatePack candidate, PackState origin, List<SeatPackId> sourcePackIds) {
        public ClassifiedPack {
            sourcePackIds = List.copyOf(sourcePackIds);
        }
    }

    /**
     * 좌석 구성은 같고 가격만 바뀐 팩
     */
    public record PriceChange(SeatPack existing, CandidatePack candidate) {
    }

    public enum RemovalKind {
        TRANSFORMED,
        VANISHED
    }

    /**
     * 새 결과에서 사라진 기존 팩
     */
    public record RemovedPack(SeatPack pack, RemovalKind kind, List<SeatPackId> childPackIds) {
        public RemovedPack {
            childPackIds = List.copyOf(childPackIds);
        }
    }

    public long countCreatedAs(PackState origin) {
        return created.stream().filter(c -> c.origin() == origin).count();
    }

    public long countRemovedAs(RemovalKind kind) {
        return removed.stream().filter(r -> r.kind() == kind).count();
    }

    public boolean hasChanges() {
        return !created.isEmpty() || !removed.isEmpty() || !equivalent.isEmpty();
    }

    public String summary() {
        return String.format("동일: %d, 가격변경: %d, 신규: %d (create %d / split %d / merge %d / shrink %d), "
                        + "제거: %d (transformed %d / vanished %d)",
                identical.size(), equivalent.size(), created.size(),
                countCreatedAs(PackState.CREATE), countCreatedAs(PackState.SPLIT),
                countCreatedAs(PackState.MERGE), countCreatedAs(PackState.SHRINK),
                removed.size(), countRemovedAs(RemovalKind.TRANSFORMED), countRemovedAs(RemovalKind.VANISHED));
    }
}

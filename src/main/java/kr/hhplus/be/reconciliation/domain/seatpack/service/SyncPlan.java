package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;

import java.util.List;

/**
 * 비교 결과로부터 만든 저장/동기화 작업 목록
 */
public record SyncPlan(
        String performanceId,
        WorkflowScenario scenario,
        List<CreationAction> creations,
        List<PriceUpdateAction> priceUpdates,
        List<DelistAction> delists,
        List<ResyncAction> resyncs
) {

    public SyncPlan {
        creations = List.copyOf(creations);
        priceUpdates = List.copyOf(priceUpdates);
        delists = List.copyOf(delists);
        resyncs = List.copyOf(resyncs);
    }

    public int totalActions() {
        return creations.size() + priceUpdates.size() + delists.size() + resyncs.size();
    }

    public boolean isEmpty() {
        return totalActions() == 0;
    }

    public record CreationAction(CandidatePack pack, PackState origin, List<SeatPackId> sourcePackIds) {
        public CreationAction {
            sourcePackIds = List.copyOf(sourcePackIds);
        }
    }

    public record PriceUpdateAction(SeatPackId packId, Money newSeatPrice, Money newTotalPrice) {
    }

    public record DelistAction(SeatPackId packId, DelistReason reason) {
    }

    /**
     * 구성은 그대로지만 POS 반영이 끝나지 않은 팩 (대기/실패)
     */
    public record ResyncAction(SeatPackId packId) {
    }
}

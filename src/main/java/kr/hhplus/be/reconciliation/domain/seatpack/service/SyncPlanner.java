package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.service.PackComparison.RemovalKind;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlan.CreationAction;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlan.DelistAction;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlan.PriceUpdateAction;
import kr.hhplus.be.reconciliation.domain.seatpack.service.SyncPlan.ResyncAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Component
public class SyncPlanner {

    public SyncPlan plan(PackComparison comparison, WorkflowScenario scenario) {
        List<CreationAction> creations = comparison.created().stream()
                .map(c -> new CreationAction(c.candidate(), c.origin(), c.sourcePackIds()))
                .toList();

        List<PriceUpdateAction> priceUpdates = comparison.equivalent().stream()
                .map(change -> new PriceUpdateAction(
                        change.existing().getId(),
                        change.candidate().seatPrice(),
                        change.candidate().totalPrice()))
                .toList();

        List<DelistAction> delists = comparison.removed().stream()
                .map(removed -> new DelistAction(removed.pack().getId(),
                        removed.kind() == RemovalKind.TRANSFORMED ? DelistReason.TRANSFORMED : DelistReason.VANISHED))
                .toList();

        // 변경 없는 팩 중 아직 POS 반영이 끝나지 않은 것
        List<ResyncAction> resyncs = new ArrayList<>();
        Stream.concat(comparison.identical().stream(), comparison.equivalent().stream().map(PackComparison.PriceChange::existing))
                .filter(pack -> pack.getPosStatus().awaitsSync())
                .map(SeatPack::getId)
                .forEach(id -> resyncs.add(new ResyncAction(id)));

        return new SyncPlan(comparison.performanceId(), scenario, creations, priceUpdates, delists, resyncs);
    }
}

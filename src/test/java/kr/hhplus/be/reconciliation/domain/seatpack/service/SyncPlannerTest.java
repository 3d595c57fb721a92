package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static kr.hhplus.be.reconciliation.support.SeatPackFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class SyncPlannerTest {

    private final SeatPackComparator comparator = new SeatPackComparator();
    private final SyncPlanner planner = new SyncPlanner();

    @Test
    @DisplayName("비교 결과를 생성/가격변경/내림/재동기화 작업으로 바꾼다")
    void plan() {
        // given
        SeatPack shrinking = listedPack("L-1", "A", "1", "2", "3", "4");
        SeatPack repriced = listedPack("L-2", "B", "1", "2");
        SeatPack pendingUnchanged = activePack("C", "1", "2");
        SeatPack vanishing = listedPack("L-3", "D", "1", "2");

        PackComparison comparison = comparator.compare(PERFORMANCE_ID,
                List.of(candidate("A", "1", "2"), pricedCandidate("B", "70.00", "1", "2"), candidate("C", "1", "2")),
                List.of(shrinking, repriced, pendingUnchanged, vanishing));

        // when
        SyncPlan plan = planner.plan(comparison, WorkflowScenario.SUBSEQUENT_SCRAPE);

        // then
        assertThat(plan.creations()).singleElement()
                .satisfies(c -> assertThat(c.origin()).isEqualTo(PackState.SHRINK));
        assertThat(plan.priceUpdates()).singleElement().satisfies(update -> {
            assertThat(update.packId()).isEqualTo(repriced.getId());
            assertThat(update.newTotalPrice()).isEqualTo(Money.of("140.00"));
        });
        assertThat(plan.delists()).extracting(SyncPlan.DelistAction::reason)
                .containsExactlyInAnyOrder(DelistReason.TRANSFORMED, DelistReason.VANISHED);
        assertThat(plan.resyncs()).extracting(SyncPlan.ResyncAction::packId)
                .containsExactly(pendingUnchanged.getId());
        assertThat(plan.totalActions()).isEqualTo(5);
    }

    @Test
    @DisplayName("활성 팩이 없으면 최초 스크랩")
    void scenario() {
        assertThat(WorkflowScenario.determine(0)).isEqualTo(WorkflowScenario.INITIAL_SCRAPE);
        assertThat(WorkflowScenario.determine(3)).isEqualTo(WorkflowScenario.SUBSEQUENT_SCRAPE);
    }
}

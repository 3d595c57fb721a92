package kr.hhplus.be.reconciliation.application.sync;

import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload;
import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.PackLocation;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static kr.hhplus.be.reconciliation.support.SeatPackFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class PosPayloadFactoryTest {

    private final PosPayloadFactory factory = new PosPayloadFactory(new ReconciliationProperties());
    private final PosPackValidator validator = new PosPackValidator();

    @Test
    @DisplayName("팩과 공연 정보로 리스팅 본문을 만든다")
    void build() {
        SeatPack source = activePack("A", "1", "2", "3", "4");
        SeatPack pack = SeatPack.create(candidate("A", "1", "2"), PackState.SHRINK,
                List.of(source.getId().value()), NOW);

        PosListingPayload payload = factory.build(pack, performance(), NOW);

        assertThat(payload.currencyCode()).isEqualTo("USD");
        assertThat(payload.deliveryType()).isEqualTo("InApp");
        assertThat(payload.unitCost()).isEqualByComparingTo(new BigDecimal("50.00"));
        assertThat(payload.ticketCount()).isEqualTo(2);
        assertThat(payload.seating().section()).isEqualTo(SECTION);
        assertThat(payload.seating().row()).isEqualTo("A");
        assertThat(payload.eventMapping().eventDate()).isEqualTo("2026-12-24T19:30:00");
        assertThat(payload.eventMapping().venueName()).isEqualTo("Richard Rodgers Theatre");
        assertThat(payload.internalNotes()).contains("shrink").contains(source.getId().value());
        assertThat(payload.listingNotes()).isNull();
    }

    @Test
    @DisplayName("휠체어 좌석 팩에는 접근성 안내를 붙인다")
    void accessibleNote() {
        CandidatePack base = candidate("A", "1", "2");
        CandidatePack accessible = new CandidatePack(base.id(), base.source(), base.location(), base.seatIds(),
                base.startSeat(), base.endSeat(), base.seatPrice(), base.totalPrice(), true);

        PosListingPayload payload = factory.build(
                SeatPack.create(accessible, PackState.CREATE, List.of(), NOW), performance(), NOW);

        assertThat(payload.listingNotes()).extracting(PosListingPayload.ListingNote::note)
                .containsExactly("Wheelchair accessible seating");
    }

    @Test
    @DisplayName("가격 0, 위치 불명, 공연 정보 없음은 모두 검증 실패 사유가 된다")
    void validator_collectsAllReasons() {
        CandidatePack base = candidate("A", "1", "2");
        CandidatePack broken = new CandidatePack(base.id(), base.source(),
                new PackLocation(PERFORMANCE_ID, null, ZONE, SECTION, null, "A"),
                base.seatIds(), base.startSeat(), base.endSeat(), Money.zero(), Money.zero(), false);

        List<String> reasons = validator.validate(SeatPack.create(broken, PackState.CREATE, List.of(), NOW), null);

        assertThat(reasons).containsExactlyInAnyOrder(
                "price must be positive", "unresolvable zone/section/row", "unknown performance");
    }
}

package kr.hhplus.be.reconciliation.support;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.seat.Seat;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.PackLocation;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * 테스트용 좌석/팩 생성 헬퍼
 */
public final class SeatPackFixtures {

    public static final String PERFORMANCE_ID = "perf-1";
    public static final String SOURCE = "ticketmaster";
    public static final String ZONE = "Z1";
    public static final String SECTION = "101";
    public static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 1, 12, 0);

    private SeatPackFixtures() {
    }

    public static Seat seat(String row, String label) {
        return seat(row, label, "50.00");
    }

    public static Seat seat(String row, String label, String price) {
        return Seat.available(seatId(row, label), ZONE, SECTION, row, label, price == null ? null : Money.of(price));
    }

    public static String seatId(String row, String label) {
        return SECTION + "-" + row + "-" + label;
    }

    public static List<Seat> row(String row, String... labels) {
        return Arrays.stream(labels).map(label -> seat(row, label)).toList();
    }

    /**
     * 생성기와 같은 규칙(첫 좌석 단가 × 좌석 수)으로 만든 후보 팩
     */
    public static CandidatePack candidate(String row, String... labels) {
        return pricedCandidate(row, "50.00", labels);
    }

    public static CandidatePack pricedCandidate(String row, String unitPrice, String... labels) {
        List<String> seatIds = Arrays.stream(labels).map(label -> seatId(row, label)).toList();
        Money unit = unitPrice == null ? null : Money.of(unitPrice);
        Money total = unit == null ? null : unit.multiply(labels.length);
        SeatPackId id = SeatPackId.generate("tm", SOURCE, PERFORMANCE_ID, null, ZONE, row, seatIds);
        PackLocation location = new PackLocation(PERFORMANCE_ID, null, ZONE, SECTION, SECTION, row);
        return new CandidatePack(id, SOURCE, location, seatIds, labels[0], labels[labels.length - 1],
                unit, total, false);
    }

    public static SeatPack activePack(String row, String... labels) {
        return SeatPack.create(candidate(row, labels), PackState.CREATE, List.of(), NOW);
    }

    /**
     * POS 에 이미 올라간 활성 팩
     */
    public static SeatPack listedPack(String listingId, String row, String... labels) {
        SeatPack pack = activePack(row, labels);
        pack.markPushed(listingId, NOW);
        return pack;
    }

    public static Performance performance() {
        return Performance.create(PERFORMANCE_ID, "venue-1", "Hamilton",
                LocalDateTime.of(2026, 12, 24, 19, 30), "Richard Rodgers Theatre", "New York", "NY", "US");
    }
}

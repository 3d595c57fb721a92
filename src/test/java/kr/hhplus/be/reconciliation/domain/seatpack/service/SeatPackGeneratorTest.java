package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;
import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;
import kr.hhplus.be.reconciliation.domain.seat.Seat;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static kr.hhplus.be.reconciliation.support.SeatPackFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class SeatPackGeneratorTest {

    private final SeatPackGenerator generator = new SeatPackGenerator();

    private GenerationRequest request(List<Seat> seats, NumberingScheme scheme, int minSize,
                                      PackingStrategy strategy, PriceMarkup markup) {
        return new GenerationRequest(PERFORMANCE_ID, SOURCE, "tm", seats, scheme, Map.of(),
                minSize, strategy, markup);
    }

    private GenerationRequest request(List<Seat> seats, NumberingScheme scheme, int minSize) {
        return request(seats, scheme, minSize, PackingStrategy.MAXIMAL, PriceMarkup.none());
    }

    @Nested
    @DisplayName("연번 체계")
    class Consecutive {

        @Test
        @DisplayName("A열 1~6 판매 가능, 최소 2석 → 1~6 팩 하나")
        void fullRow_singlePack() {
            // given
            List<Seat> seats = row("A", "1", "2", "3", "4", "5", "6");

            // when
            List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 2));

            // then
            assertThat(packs).hasSize(1);
            CandidatePack pack = packs.get(0);
            assertThat(pack.startSeat()).isEqualTo("1");
            assertThat(pack.endSeat()).isEqualTo("6");
            assertThat(pack.packSize()).isEqualTo(6);
            assertThat(pack.id()).isEqualTo(candidate("A", "1", "2", "3", "4", "5", "6").id());
            assertThat(pack.totalPrice()).isEqualTo(Money.of("300.00"));
        }

        @Test
        @DisplayName("판매된 좌석에서 구간이 끊기고, 최소 크기 미만 구간은 버린다")
        void gapsSplitRuns() {
            List<Seat> seats = new ArrayList<>(row("A", "1", "2", "3", "5", "6"));
            seats.add(new Seat(seatId("A", "4"), null, ZONE, SECTION, SECTION, "A", "4", false, Money.of("50"), false));
            seats.addAll(row("A", "8"));

            List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 2));

            assertThat(packs).extracting(CandidatePack::startSeat, CandidatePack::endSeat)
                    .containsExactly(
                            org.assertj.core.groups.Tuple.tuple("1", "3"),
                            org.assertj.core.groups.Tuple.tuple("5", "6"));
        }

        @Test
        @DisplayName("입력 순서와 무관하게 자연 정렬로 구간을 만든다")
        void unorderedInput_naturalOrder() {
            List<Seat> seats = row("A", "10", "9", "8", "11");

            List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 2));

            assertThat(packs).singleElement().satisfies(pack -> {
                assertThat(pack.startSeat()).isEqualTo("8");
                assertThat(pack.endSeat()).isEqualTo("11");
            });
        }

        @Test
        @DisplayName("번호가 이어져도 구역이 다르면 다른 팩")
        void zoneBoundary_neverCrossed() {
            List<Seat> seats = List.of(
                    new Seat("s1", null, "Z1", SECTION, SECTION, "A", "1", true, Money.of("50"), false),
                    new Seat("s2", null, "Z1", SECTION, SECTION, "A", "2", true, Money.of("50"), false),
                    new Seat("s3", null, "Z2", SECTION, SECTION, "A", "3", true, Money.of("50"), false),
                    new Seat("s4", null, "Z2", SECTION, SECTION, "A", "4", true, Money.of("50"), false));

            List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 2));

            assertThat(packs).hasSize(2);
            assertThat(packs).extracting(p -> p.location().zoneId()).containsExactlyInAnyOrder("Z1", "Z2");
        }

        @Test
        @DisplayName("섹션이 없는 좌석은 대상에서 제외")
        void seatsWithoutSection_skipped() {
            List<Seat> seats = List.of(
                    new Seat("s1", null, ZONE, null, null, "A", "1", true, Money.of("50"), false),
                    new Seat("s2", null, ZONE, null, null, "A", "2", true, Money.of("50"), false));

            assertThat(generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 1))).isEmpty();
        }

        @Test
        @DisplayName("최소 크기가 1 미만이면 1로 보정해 단일 좌석도 팩이 된다")
        void minSizeClampedToOne() {
            List<Seat> seats = row("A", "1", "5");

            assertThat(generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 0))).hasSize(2);
        }
    }

    @Test
    @DisplayName("홀짝 체계는 홀수/짝수 좌석을 각각 이어 붙인다")
    void oddEven_separateRuns() {
        List<Seat> seats = row("B", "1", "2", "3", "4", "5", "6", "7", "8");

        List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.ODD_EVEN, 2));

        assertThat(packs).hasSize(2);
        assertThat(packs).extracting(CandidatePack::startSeat, CandidatePack::endSeat)
                .containsExactlyInAnyOrder(
                        org.assertj.core.groups.Tuple.tuple("1", "7"),
                        org.assertj.core.groups.Tuple.tuple("2", "8"));
    }

    @Test
    @DisplayName("EXHAUSTIVE 는 최소 크기 이상의 모든 부분 구간을 만든다")
    void exhaustive_allWindows() {
        List<Seat> seats = row("A", "1", "2", "3", "4");

        List<CandidatePack> packs = generator.generate(
                request(seats, NumberingScheme.CONSECUTIVE, 2, PackingStrategy.EXHAUSTIVE, PriceMarkup.none()));

        // 2석 3개 + 3석 2개 + 4석 1개
        assertThat(packs).hasSize(6);
        assertThat(packs).extracting(CandidatePack::id).doesNotHaveDuplicates();
    }

    @Nested
    @DisplayName("가격")
    class Pricing {

        @Test
        @DisplayName("퍼센트 마크업은 총액에 비율만큼 더한다")
        void percentageMarkup() {
            List<CandidatePack> packs = generator.generate(request(row("A", "1", "2"),
                    NumberingScheme.CONSECUTIVE, 2, PackingStrategy.MAXIMAL, PriceMarkup.percentage("10")));

            assertThat(packs.get(0).seatPrice()).isEqualTo(Money.of("50.00"));
            assertThat(packs.get(0).totalPrice()).isEqualTo(Money.of("110.00"));
        }

        @Test
        @DisplayName("고정 마크업은 총액에 금액을 더한다")
        void flatMarkup() {
            List<CandidatePack> packs = generator.generate(request(row("A", "1", "2"),
                    NumberingScheme.CONSECUTIVE, 2, PackingStrategy.MAXIMAL, PriceMarkup.flat("7.50")));

            assertThat(packs.get(0).totalPrice()).isEqualTo(Money.of("107.50"));
        }

        @Test
        @DisplayName("단가를 모르면 가격 없이 생성된다")
        void missingPrice_nullTotals() {
            List<Seat> seats = List.of(seat("A", "1", null), seat("A", "2", null));

            List<CandidatePack> packs = generator.generate(request(seats, NumberingScheme.CONSECUTIVE, 2));

            assertThat(packs.get(0).seatPrice()).isNull();
            assertThat(packs.get(0).totalPrice()).isNull();
        }
    }

    @Test
    @DisplayName("공연장 번호 체계 판별")
    void detectVenueScheme() {
        List<Seat> seats = new ArrayList<>(row("A", "1", "3", "5", "7"));
        seats.addAll(row("B", "2", "4", "6"));

        assertThat(generator.detectVenueScheme(seats)).isEqualTo(NumberingScheme.ODD_EVEN);
    }
}

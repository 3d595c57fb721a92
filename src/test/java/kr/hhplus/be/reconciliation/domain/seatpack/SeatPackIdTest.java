package kr.hhplus.be.reconciliation.domain.seatpack;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatPackIdTest {

    @Test
    @DisplayName("좌석 순서와 무관하게 같은 구성이면 같은 ID")
    void sameSeatsInAnyOrder_produceSameId() {
        SeatPackId first = SeatPackId.generate("tm", "ticketmaster", "perf-1", "L1", "Z1", "A",
                List.of("s1", "s2", "s3"));
        SeatPackId second = SeatPackId.generate("tm", "ticketmaster", "perf-1", "L1", "Z1", "A",
                List.of("s3", "s1", "s2"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("형식은 {prefix}_pk_{16자리 해시}")
    void idFormat() {
        SeatPackId id = SeatPackId.generate("sg", "seatgeek", "perf-1", null, "Z1", "A", List.of("s1"));

        assertThat(id.value()).matches("sg_pk_[0-9a-f]{16}");
    }

    @Test
    @DisplayName("레벨이 없으면 unknown 으로 취급")
    void missingLevel_treatedAsUnknown() {
        SeatPackId blank = SeatPackId.generate("tm", "ticketmaster", "perf-1", "", "Z1", "A", List.of("s1"));
        SeatPackId unknown = SeatPackId.generate("tm", "ticketmaster", "perf-1", "unknown", "Z1", "A", List.of("s1"));

        assertThat(blank).isEqualTo(unknown);
    }

    @Test
    @DisplayName("공연/열/좌석이 하나라도 다르면 다른 ID")
    void differentComposition_differentId() {
        SeatPackId base = SeatPackId.generate("tm", "ticketmaster", "perf-1", null, "Z1", "A", List.of("s1", "s2"));

        assertThat(SeatPackId.generate("tm", "ticketmaster", "perf-2", null, "Z1", "A", List.of("s1", "s2")))
                .isNotEqualTo(base);
        assertThat(SeatPackId.generate("tm", "ticketmaster", "perf-1", null, "Z1", "B", List.of("s1", "s2")))
                .isNotEqualTo(base);
        assertThat(SeatPackId.generate("tm", "ticketmaster", "perf-1", null, "Z1", "A", List.of("s1", "s3")))
                .isNotEqualTo(base);
    }

    @Test
    @DisplayName("빈 값은 허용하지 않는다")
    void blankValue_rejected() {
        assertThatThrownBy(() -> SeatPackId.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
